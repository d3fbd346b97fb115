package org.asmdoc.frontend.lexer;

import org.asmdoc.api.ParseErrorKind;
import org.asmdoc.api.ParseException;
import org.asmdoc.api.RuleFrame;
import org.asmdoc.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * NASM source code into a sequence of tokens.
 * <p>
 * Blanks are dropped, newlines are kept as {@link TokenType#NEWLINE} tokens and the
 * stream always ends with a single {@link TokenType#END_OF_FILE} token. The first
 * character that starts no valid token aborts scanning with
 * {@link ParseErrorKind#INVALID_INPUT}.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "bits", TokenType.BITS,
            "section", TokenType.SECTION,
            "global", TokenType.GLOBAL,
            "extern", TokenType.EXTERN,
            "qword", TokenType.QWORD,
            "dword", TokenType.DWORD
    );

    private static final Map<String, TokenType> PREPROCESSOR_KEYWORDS = Map.of(
            "%include", TokenType.INCLUDE,
            "%define", TokenType.DEFINE,
            "%macro", TokenType.MACRO,
            "%endmacro", TokenType.END_MACRO
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being scanned, for token locations.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by an end-of-file token.
     * @throws ParseException if some input position matches no token rule.
     */
    public List<Token> scanTokens() throws ParseException {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
        return tokens;
    }

    private void scanToken() throws ParseException {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\f', '\r':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                column = 1;
                break;
            case ';':
                while (peek() != '\n' && !isAtEnd()) advance();
                addToken(TokenType.COMMENT);
                break;
            case '"', '\'':
                string(c);
                break;
            case '$':
                if (isMacroNameChar(peek())) {
                    while (isMacroNameChar(peek())) advance();
                    addToken(TokenType.MACRO_CALL);
                } else {
                    addToken(TokenType.CURRENT_POSITION);
                }
                break;
            case '%':
                percent();
                break;
            case ':': addToken(TokenType.COLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.ASTERISK); break;
            case '/': addToken(TokenType.SLASH); break;
            case '~': addToken(TokenType.BIT_NOT); break;
            case '|': addToken(TokenType.BIT_OR); break;
            case '^': addToken(TokenType.BIT_XOR); break;
            case '&': addToken(TokenType.BIT_AND); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    throw invalidInput();
                }
                break;
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);

        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            if (Mnemonics.isMnemonic(text)) {
                type = TokenType.MNEMONIC;
            } else if (isRegister(text)) {
                type = TokenType.REGISTER;
            } else {
                type = TokenType.SYMBOL;
            }
        }
        addToken(type);
    }

    /**
     * Numbered registers: {@code r} followed by digits only.
     */
    private boolean isRegister(String text) {
        if (text.length() < 2 || text.charAt(0) != 'r') {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            if (!isDigit(text.charAt(i))) return false;
        }
        return true;
    }

    private void percent() throws ParseException {
        if (isDigit(peek())) {
            while (isDigit(peek())) advance();
            String digits = source.substring(start + 1, current);
            addToken(TokenType.MACRO_ARG, parseNumber(digits));
            return;
        }

        // Longest keyword that starts here wins; anything else after '%' is not part of the grammar.
        String keyword = null;
        for (String candidate : PREPROCESSOR_KEYWORDS.keySet()) {
            if (source.startsWith(candidate, start) && (keyword == null || candidate.length() > keyword.length())) {
                keyword = candidate;
            }
        }
        if (keyword == null) {
            throw invalidInput();
        }
        while (current < start + keyword.length()) advance();
        addToken(PREPROCESSOR_KEYWORDS.get(keyword));
    }

    private void number() {
        if (previous() == '0' && isRadixPrefix(peek()) && isHexDigit(peekNext())) {
            advance(); // consume the radix letter
            while (isAlphaNumeric(peek())) advance();
        } else {
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        addToken(TokenType.NUMBER, parseNumber(text));
    }

    /**
     * Parses a decimal, {@code 0x}, {@code 0b} or {@code 0o} literal.
     * @return The value, or null if it does not fit in a long or has invalid digits.
     */
    private Long parseNumber(String text) {
        String digits = text;
        int radix = 10;
        if (text.length() > 2 && text.charAt(0) == '0') {
            switch (Character.toLowerCase(text.charAt(1))) {
                case 'x': radix = 16; digits = text.substring(2); break;
                case 'b': radix = 2; digits = text.substring(2); break;
                case 'o': radix = 8; digits = text.substring(2); break;
                default: break;
            }
        }
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void string(char quote) throws ParseException {
        while (peek() != quote && !isAtEnd()) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                c = advance();
            }
            if (c == '\n') {
                line++;
                column = 1;
            }
        }

        if (isAtEnd()) {
            throw invalidInput();
        }

        // The closing quote
        advance();

        // The text of the token keeps the quotes, the value is the raw content.
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
    }

    private ParseException invalidInput() {
        return ParseException.of(ParseErrorKind.INVALID_INPUT,
                List.of(new RuleFrame("lex", new SourceInfo(logicalFileName, startLine, startColumn))));
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, startLine, startColumn, logicalFileName));
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isRadixPrefix(char c) {
        return c == 'x' || c == 'X' || c == 'b' || c == 'B' || c == 'o' || c == 'O';
    }

    private boolean isIdentifierStart(char c) {
        return isAlpha(c) || c == '_' || c == '.';
    }

    private boolean isIdentifierPart(char c) {
        return isAlphaNumeric(c) || c == '.' || c == '$';
    }

    private boolean isMacroNameChar(char c) {
        return isAlphaNumeric(c) || c == '.';
    }
}
