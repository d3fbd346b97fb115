package org.asmdoc.frontend.parser;

import org.asmdoc.api.ParseErrorKind;
import org.asmdoc.api.ParseException;
import org.asmdoc.api.ReceivedToken;
import org.asmdoc.api.RuleFrame;
import org.asmdoc.frontend.directive.DirectiveHandlerRegistry;
import org.asmdoc.frontend.directive.IDirectiveHandler;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.features.label.LabelHandler;
import org.asmdoc.model.AssemblyFile;
import org.asmdoc.model.AssemblySection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The recursive-descent parser for NASM sources. It consumes the tokens produced by
 * the {@link org.asmdoc.frontend.lexer.Lexer} and fills an {@link AssemblyFile}.
 * <p>
 * Each top-level construct is parsed by one {@link IDirectiveHandler}. While a handler
 * runs, its rule name and entry location sit on a rule stack; the first failure
 * snapshots that stack into the thrown {@link ParseException}. There is no recovery:
 * a failure aborts the whole file. A parser instance parses once.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final DirectiveHandlerRegistry directiveRegistry;
    private final IDirectiveHandler labelHandler = new LabelHandler();
    private final Deque<RuleFrame> ruleStack = new ArrayDeque<>();
    private final AssemblyFile.Builder file = AssemblyFile.builder();
    private AssemblySection currentSection = AssemblySection.TEXT;
    private int current = 0;

    /**
     * Constructs a new Parser with the built-in NASM handlers.
     * @param tokens The list of tokens to parse, terminated by an end-of-file token.
     */
    public Parser(List<Token> tokens) {
        this(tokens, DirectiveHandlerRegistry.initialize());
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by an end-of-file token.
     * @param directiveRegistry The handlers for top-level constructs.
     */
    public Parser(List<Token> tokens, DirectiveHandlerRegistry directiveRegistry) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalArgumentException("Token stream must end with an END_OF_FILE token.");
        }
        this.tokens = tokens;
        this.directiveRegistry = directiveRegistry;
    }

    /**
     * Parses the entire token stream.
     * @return The complete file model.
     * @throws ParseException on the first construct that does not match the grammar.
     */
    public AssemblyFile parse() throws ParseException {
        if (!isAtEnd()) {
            ruleStack.addLast(new RuleFrame("parse", peek().location()));
        }
        skipBlankLines();
        while (!isAtEnd()) {
            statement();
            skipBlankLines();
        }
        ruleStack.clear();
        return file.build();
    }

    private void statement() throws ParseException {
        Token token = peek();
        if (token.type() == TokenType.COMMENT) {
            // Comments are not attached to any item.
            advance();
            return;
        }
        if (token.type() == TokenType.SYMBOL && checkNext(TokenType.COLON)) {
            invoke(labelHandler);
            return;
        }
        Optional<IDirectiveHandler> handler = directiveRegistry.get(token.type());
        if (handler.isEmpty()) {
            throw error(ParseErrorKind.INVALID_SYNTAX);
        }
        invoke(handler.get());
    }

    private void invoke(IDirectiveHandler handler) throws ParseException {
        if (isAtEnd()) {
            throw error(ParseErrorKind.UNEXPECTED_EOF);
        }
        ruleStack.addLast(new RuleFrame(handler.ruleName(), peek().location()));
        handler.parse(this);
        ruleStack.removeLast();
    }

    private void skipBlankLines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    /**
     * Returns the rule frames that are active right now, innermost last.
     * @return A snapshot of the rule stack.
     */
    public List<RuleFrame> currentTrace() {
        return new ArrayList<>(ruleStack);
    }

    private List<RuleFrame> traceAtCurrentToken() {
        List<RuleFrame> trace = currentTrace();
        Token token = peek();
        String name = isAtEnd() ? "end-of-file" : token.type().name();
        trace.add(new RuleFrame(name, token.location()));
        return trace;
    }

    @Override
    public ParseException error(ParseErrorKind kind) {
        return ParseException.of(kind, traceAtCurrentToken());
    }

    @Override
    public Token expect(TokenType type) throws ParseException {
        if (check(type)) {
            return advance();
        }
        ReceivedToken received = isAtEnd() ? null : new ReceivedToken(peek().type().name(), peek().text());
        throw ParseException.unexpected(type.name(), received, traceAtCurrentToken());
    }

    @Override
    public void expectNewline() throws ParseException {
        match(TokenType.COMMENT);
        expect(TokenType.NEWLINE);
    }

    @Override
    public int expectUnsignedInt() throws ParseException {
        Token number = expect(TokenType.NUMBER);
        if (number.value() instanceof Long value && value >= 0 && value <= Integer.MAX_VALUE) {
            return value.intValue();
        }
        throw error(ParseErrorKind.INVALID_SYNTAX);
    }

    @Override
    public List<Token> skipToEndOfLine() {
        List<Token> skipped = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.NEWLINE)) {
            Token token = advance();
            if (token.type() != TokenType.COMMENT) {
                skipped.add(token);
            }
        }
        return skipped;
    }

    @Override
    public List<Token> skipUntil(TokenType type) {
        List<Token> skipped = new ArrayList<>();
        while (!isAtEnd() && !check(type)) {
            skipped.add(advance());
        }
        return skipped;
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    /**
     * Checks the type of the next token without consuming anything.
     * @param type The token type to check.
     * @return true if the token after the current one is of the given type.
     */
    public boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public AssemblyFile.Builder file() {
        return file;
    }

    @Override
    public AssemblySection currentSection() {
        return currentSection;
    }

    @Override
    public void setCurrentSection(AssemblySection section) {
        this.currentSection = section;
    }
}
