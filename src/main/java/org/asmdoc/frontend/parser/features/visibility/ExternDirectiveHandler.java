package org.asmdoc.frontend.parser.features.visibility;

import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;

/**
 * Handler for <code>extern &lt;symbol&gt;</code>, which declares a symbol defined elsewhere.
 */
public class ExternDirectiveHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "extern";
    }

    @Override
    public void parse(ParsingContext context) throws ParseException {
        context.expect(TokenType.EXTERN);
        Token symbol = context.expect(TokenType.SYMBOL);
        context.expectNewline();
        context.file().addExtern(symbol.text());
    }
}
