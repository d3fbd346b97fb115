package org.asmdoc.frontend.parser.features.def;

import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;
import org.asmdoc.model.AssemblyDefine;

import java.util.List;

/**
 * Handler for the <code>%define</code> directive.
 * The syntax is <code>%define &lt;name&gt; [value...]</code>; the value is kept unparsed.
 */
public class DefineDirectiveHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "define";
    }

    @Override
    public void parse(ParsingContext context) throws ParseException {
        Token directive = context.expect(TokenType.DEFINE);
        Token name = context.expect(TokenType.SYMBOL);
        List<Token> value = context.skipToEndOfLine();
        context.expectNewline();
        context.file().addDefine(new AssemblyDefine(name.text(), value, directive.location()));
    }
}
