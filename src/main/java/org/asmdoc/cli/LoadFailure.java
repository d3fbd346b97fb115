package org.asmdoc.cli;

import java.nio.file.Path;

/**
 * A source file that could not be turned into a file model.
 *
 * @param file The source file.
 * @param kind Whether reading or parsing failed.
 * @param message The human-readable reason; for parse failures this includes the rule trace.
 */
public record LoadFailure(Path file, Kind kind, String message) {

    /**
     * The stage at which loading failed.
     */
    public enum Kind {
        /** The file could not be read or is not valid UTF-8 text. */
        IO,
        /** The file was read but does not match the grammar. */
        PARSE
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", kind, file, message);
    }
}
