package org.asmdoc.frontend.parser.features.mnemonic;

import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;

/**
 * Parses an instruction line. Operands are not decoded: everything after the
 * mnemonic up to the newline is skipped.
 */
public class MnemonicHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "mnemonic";
    }

    @Override
    public void parse(ParsingContext context) throws ParseException {
        context.expect(TokenType.MNEMONIC);
        context.skipToEndOfLine();
        context.expectNewline();
    }
}
