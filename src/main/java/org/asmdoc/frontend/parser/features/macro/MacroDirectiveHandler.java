package org.asmdoc.frontend.parser.features.macro;

import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;
import org.asmdoc.model.AssemblyMacro;

import java.util.List;

/**
 * Handles the <code>%macro</code> and <code>%endmacro</code> directives.
 * Only the header is parsed; the body is kept as raw tokens and never checked
 * against the grammar.
 */
public class MacroDirectiveHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "macro_definition";
    }

    /**
     * Parses <code>%macro &lt;name&gt; &lt;argCount&gt; ... %endmacro</code>.
     * The name may be written with or without the <code>$</code> call sigil.
     * @param context The parsing context.
     * @throws ParseException if the header is malformed or <code>%endmacro</code> is missing.
     */
    @Override
    public void parse(ParsingContext context) throws ParseException {
        Token directive = context.expect(TokenType.MACRO);
        Token name = context.check(TokenType.SYMBOL) ? context.advance() : context.expect(TokenType.MACRO_CALL);
        int argCount = context.expectUnsignedInt();
        List<Token> body = context.skipUntil(TokenType.END_MACRO);
        context.expect(TokenType.END_MACRO);
        context.file().addMacro(new AssemblyMacro(name.text(), argCount, body, directive.location()));
    }
}
