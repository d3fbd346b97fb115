package org.asmdoc.api;

/**
 * A pure data class representing a position in the source code.
 *
 * @param fileName The file where the code is located.
 * @param line The 1-based line number.
 * @param column The 1-based column number.
 */
public record SourceInfo(String fileName, int line, int column) {

    /**
     * Returns the last segment of {@link #fileName()}, as shown in diagnostics.
     * @return The bare file name.
     */
    public String displayName() {
        if (fileName == null) {
            return "<unknown>";
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return slash >= 0 ? fileName.substring(slash + 1) : fileName;
    }

    @Override
    public String toString() {
        return displayName() + ":" + line + ":" + column;
    }
}
