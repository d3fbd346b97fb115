package org.asmdoc.model;

import org.asmdoc.api.SourceInfo;

/**
 * A label definition (e.g. {@code main:} or {@code .loop:}).
 *
 * @param name The label name as written, including a leading dot for sub-labels.
 * @param source Where the label was defined.
 */
public record LabelItem(String name, SourceInfo source) implements AssemblyItem {

    /**
     * Dotted labels belong to the closest preceding top-level label.
     * @return true if this is a sub-label.
     */
    public boolean isSubLabel() {
        return name.startsWith(".");
    }
}
