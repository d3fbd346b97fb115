package org.asmdoc.frontend.parser.features.bits;

import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;

/**
 * Handler for the <code>bits</code> directive.
 * The syntax is <code>bits &lt;number&gt;</code>; the number becomes the word size of the file.
 */
public class BitsDirectiveHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "bits";
    }

    @Override
    public void parse(ParsingContext context) throws ParseException {
        context.expect(TokenType.BITS);
        context.file().bits(context.expectUnsignedInt());
    }
}
