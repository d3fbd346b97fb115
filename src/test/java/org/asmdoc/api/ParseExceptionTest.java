package org.asmdoc.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the rendering of {@link ParseException} messages.
 */
class ParseExceptionTest {

    private static final List<RuleFrame> TRACE = List.of(
            new RuleFrame("parse", new SourceInfo("src/a.asm", 1, 1)),
            new RuleFrame("extern", new SourceInfo("src/a.asm", 4, 1)));

    @Test
    @Tag("unit")
    void describesEveryKind() {
        assertThat(ParseException.of(ParseErrorKind.INVALID_INPUT, List.of()).describeKind()).isEqualTo("Invalid input");
        assertThat(ParseException.of(ParseErrorKind.UNEXPECTED_EOF, List.of()).describeKind()).isEqualTo("Unexpected end-of-file");
        assertThat(ParseException.of(ParseErrorKind.INVALID_SYNTAX, List.of()).describeKind()).isEqualTo("Invalid syntax");
        assertThat(ParseException.unexpected("STRING", null, List.of()).describeKind()).isEqualTo("Expected STRING");
    }

    @Test
    @Tag("unit")
    void joinsTraceFramesWithFileNamesOnly() {
        // Arrange
        ReceivedToken received = new ReceivedToken("NUMBER", "42");

        // Act
        ParseException error = ParseException.unexpected("SYMBOL", received, TRACE);

        // Assert
        assertThat(error.getMessage())
                .isEqualTo("parse(a.asm:1:1) > extern(a.asm:4:1): Expected SYMBOL, but received NUMBER (`42`)");
        assertThat(error.getTrace()).isEqualTo(TRACE);
    }

    @Test
    @Tag("unit")
    void escapesControlCharactersOfReceivedText() {
        ReceivedToken tab = new ReceivedToken("NEWLINE", "\r\n\t");

        assertThat(ParseException.unexpected("SYMBOL", tab, List.of()).getMessage())
                .isEqualTo("Expected SYMBOL, but received NEWLINE (`\\r\\n\\t`)");
    }
}
