package org.asmdoc.frontend.parser.features.macro;

import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;
import org.asmdoc.model.MacroCallItem;

import java.util.List;

/**
 * Parses a macro invocation line (e.g. <code>$print msg</code>) into a
 * {@link MacroCallItem} of the active section.
 */
public class MacroCallHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "macro_call";
    }

    @Override
    public void parse(ParsingContext context) throws ParseException {
        Token name = context.expect(TokenType.MACRO_CALL);
        List<Token> arguments = context.skipToEndOfLine();
        context.expectNewline();
        context.addItem(new MacroCallItem(name.text(), arguments, name.location()));
    }
}
