package org.asmdoc.frontend.parser.features.visibility;

import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;

/**
 * Handler for <code>global &lt;symbol&gt;</code>, which exports a symbol of this file.
 */
public class GlobalDirectiveHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "global";
    }

    @Override
    public void parse(ParsingContext context) throws ParseException {
        context.expect(TokenType.GLOBAL);
        Token symbol = context.expect(TokenType.SYMBOL);
        context.expectNewline();
        context.file().addGlobal(symbol.text());
    }
}
