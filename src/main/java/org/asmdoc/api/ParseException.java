package org.asmdoc.api;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Thrown when a source file cannot be tokenized or parsed.
 * <p>
 * Besides the {@link ParseErrorKind}, the exception carries a snapshot of the rule
 * trace that was active at the point of failure, so the message can be rendered as
 * {@code parse(a.asm:1:1) > global(a.asm:3:1) > NEWLINE(a.asm:3:7): Expected SYMBOL, but received NEWLINE (`\n`)}.
 */
public class ParseException extends Exception {

    private final ParseErrorKind kind;
    private final String expected;
    private final ReceivedToken received;
    private final List<RuleFrame> trace;

    /**
     * Constructs a new parse exception.
     *
     * @param kind The kind of failure.
     * @param expected The name of the expected token type for {@link ParseErrorKind#UNEXPECTED}, otherwise null.
     * @param received The token found instead, or null if the input ended.
     * @param trace The rule trace at the point of failure.
     */
    public ParseException(ParseErrorKind kind, String expected, ReceivedToken received, List<RuleFrame> trace) {
        super(format(kind, expected, received, trace), null);
        this.kind = kind;
        this.expected = expected;
        this.received = received;
        this.trace = List.copyOf(trace);
    }

    /**
     * Creates an exception for a failure without a token expectation.
     * @param kind The kind of failure.
     * @param trace The rule trace.
     * @return The new exception.
     */
    public static ParseException of(ParseErrorKind kind, List<RuleFrame> trace) {
        return new ParseException(kind, null, null, trace);
    }

    /**
     * Creates an exception for a token-type mismatch.
     * @param expected The name of the token type that was required.
     * @param received The token found instead, or null at end of input.
     * @param trace The rule trace.
     * @return The new exception.
     */
    public static ParseException unexpected(String expected, ReceivedToken received, List<RuleFrame> trace) {
        return new ParseException(ParseErrorKind.UNEXPECTED, expected, received, trace);
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    public Optional<String> getExpected() {
        return Optional.ofNullable(expected);
    }

    public Optional<ReceivedToken> getReceived() {
        return Optional.ofNullable(received);
    }

    public List<RuleFrame> getTrace() {
        return trace;
    }

    /**
     * Describes the failure without the trace, e.g. {@code Expected SYMBOL, but received NEWLINE (`\n`)}.
     * @return The description.
     */
    public String describeKind() {
        return describe(kind, expected, received);
    }

    private static String format(ParseErrorKind kind, String expected, ReceivedToken received, List<RuleFrame> trace) {
        String description = describe(kind, expected, received);
        if (trace.isEmpty()) {
            return description;
        }
        return trace.stream().map(RuleFrame::toString).collect(Collectors.joining(" > ")) + ": " + description;
    }

    private static String describe(ParseErrorKind kind, String expected, ReceivedToken received) {
        switch (kind) {
            case INVALID_INPUT:
                return "Invalid input";
            case UNEXPECTED_EOF:
                return "Unexpected end-of-file";
            case INVALID_SYNTAX:
                return "Invalid syntax";
            case UNEXPECTED:
            default:
                StringBuilder sb = new StringBuilder("Expected ").append(expected);
                if (received != null) {
                    sb.append(", but received ").append(received.type())
                            .append(" (`").append(escape(received.text())).append("`)");
                }
                return sb.toString();
        }
    }

    private static String escape(String text) {
        return text.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t");
    }
}
