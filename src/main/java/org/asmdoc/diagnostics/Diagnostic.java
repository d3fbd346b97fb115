package org.asmdoc.diagnostics;

import org.asmdoc.api.SourceInfo;

/**
 * A non-fatal warning reported while resolving a project. The affected item is
 * still documented.
 *
 * @param message The warning message.
 * @param source Where the finding was made.
 */
public record Diagnostic(String message, SourceInfo source) {

    @Override
    public String toString() {
        return String.format("[WARNING] %s:%d: %s", source.displayName(), source.line(), message);
    }
}
