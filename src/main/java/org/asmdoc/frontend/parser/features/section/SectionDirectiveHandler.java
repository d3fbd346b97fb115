package org.asmdoc.frontend.parser.features.section;

import org.asmdoc.api.ParseErrorKind;
import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;
import org.asmdoc.model.AssemblySection;

/**
 * Handler for the <code>section</code> directive.
 * Switches the section that subsequent labels and macro calls are recorded in.
 */
public class SectionDirectiveHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "section";
    }

    /**
     * Parses <code>section &lt;name&gt;</code>. The name is matched case-insensitively
     * against <code>.text</code>, <code>.data</code>, <code>.rodata</code> and <code>.bss</code>.
     * @param context The parsing context.
     * @throws ParseException with {@link ParseErrorKind#INVALID_SYNTAX} for any other name.
     */
    @Override
    public void parse(ParsingContext context) throws ParseException {
        context.expect(TokenType.SECTION);
        Token name = context.expect(TokenType.SYMBOL);
        AssemblySection section = AssemblySection.fromDirectiveName(name.text())
                .orElseThrow(() -> context.error(ParseErrorKind.INVALID_SYNTAX));
        context.expectNewline();
        context.setCurrentSection(section);
    }
}
