package org.asmdoc.frontend.lexer;

import org.asmdoc.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Mnemonic, Symbol, Number).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (the numeric value of a number,
 *              the unquoted content of a string), or null.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name from which this token originates.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Returns the location of this token as a {@link SourceInfo}.
     * @return The token location.
     */
    public SourceInfo location() {
        return new SourceInfo(fileName, line, column);
    }
}
