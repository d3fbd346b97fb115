package org.asmdoc.frontend.parser;

import org.asmdoc.api.ParseErrorKind;
import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.model.AssemblyFile;
import org.asmdoc.model.AssemblyItem;
import org.asmdoc.model.AssemblySection;

import java.util.List;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides handlers with access to the token stream and the file model under
 * construction without coupling them directly to the {@link Parser}.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @return The consumed token.
     * @throws ParseException with {@link ParseErrorKind#UNEXPECTED} if the type does not match
     *                        or the input has ended.
     */
    Token expect(TokenType type) throws ParseException;

    /**
     * Consumes the newline that terminates a statement. A comment directly before it is allowed.
     * @throws ParseException if no newline follows.
     */
    void expectNewline() throws ParseException;

    /**
     * Consumes a {@link TokenType#NUMBER} and returns its value as a non-negative int.
     * @return The value.
     * @throws ParseException with {@link ParseErrorKind#INVALID_SYNTAX} if the literal is not an unsigned integer.
     */
    int expectUnsignedInt() throws ParseException;

    /**
     * Consumes all tokens up to, but not including, the next newline.
     * @return The consumed tokens, without comments.
     */
    List<Token> skipToEndOfLine();

    /**
     * Consumes all tokens up to, but not including, the next token of the given type.
     * @param type The token type to stop at.
     * @return The consumed tokens.
     */
    List<Token> skipUntil(TokenType type);

    /**
     * Creates an error of the given kind carrying the current rule trace.
     * @param kind The error kind.
     * @return The exception to throw.
     */
    ParseException error(ParseErrorKind kind);

    /**
     * Gets the file model being built.
     * @return The builder of the file model.
     */
    AssemblyFile.Builder file();

    /**
     * Gets the section that labels and macro calls are currently recorded in.
     * @return The active section.
     */
    AssemblySection currentSection();

    /**
     * Switches the active section.
     * @param section The new active section.
     */
    void setCurrentSection(AssemblySection section);

    /**
     * Appends an item to the active section.
     * @param item The item to record.
     */
    default void addItem(AssemblyItem item) {
        file().addItem(currentSection(), item);
    }
}
