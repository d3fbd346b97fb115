package org.asmdoc.diagnostics;

import org.asmdoc.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the warnings of one project resolution, so the resolver itself never
 * has to fail or print anything.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> warnings = new ArrayList<>();

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param source  Where the warning applies.
     */
    public void reportWarning(String message, SourceInfo source) {
        warnings.add(new Diagnostic(message, source));
    }

    /**
     * Returns the reported warnings in report order.
     *
     * @return An unmodifiable copy of the warnings.
     */
    public List<Diagnostic> getWarnings() {
        return List.copyOf(warnings);
    }
}
