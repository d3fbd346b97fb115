package org.asmdoc.frontend.parser.features.label;

import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;
import org.asmdoc.model.LabelItem;

/**
 * Parses a label definition (e.g. "main:") into a {@link LabelItem} of the active section.
 * An instruction may follow on the same line, so no newline is required.
 */
public class LabelHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "label";
    }

    @Override
    public void parse(ParsingContext context) throws ParseException {
        Token name = context.expect(TokenType.SYMBOL);
        context.expect(TokenType.COLON);
        context.addItem(new LabelItem(name.text(), name.location()));
    }
}
