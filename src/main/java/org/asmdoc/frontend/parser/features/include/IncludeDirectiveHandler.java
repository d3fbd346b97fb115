package org.asmdoc.frontend.parser.features.include;

import org.asmdoc.api.ParseErrorKind;
import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.ParsingContext;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Handles the <code>%include</code> directive.
 * The included file is only recorded, never read.
 */
public class IncludeDirectiveHandler implements IDirectiveHandler {

    @Override
    public String ruleName() {
        return "include";
    }

    /**
     * Parses <code>%include "path/to/file.asm"</code> and records the path without its quotes.
     * @param context The parsing context.
     * @throws ParseException if the path is missing or is not a valid path on this platform.
     */
    @Override
    public void parse(ParsingContext context) throws ParseException {
        context.expect(TokenType.INCLUDE);
        Token pathToken = context.expect(TokenType.STRING);
        Path path;
        try {
            path = Path.of((String) pathToken.value());
        } catch (InvalidPathException e) {
            throw context.error(ParseErrorKind.INVALID_SYNTAX);
        }
        context.expectNewline();
        context.file().addInclude(path);
    }
}
