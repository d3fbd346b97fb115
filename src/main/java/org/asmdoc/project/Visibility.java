package org.asmdoc.project;

import java.util.Locale;

/**
 * How a symbol is visible from the point of view of the file that lists it.
 */
public enum Visibility {
    /** Defined with a label in this file and exported with {@code global}. */
    GLOBAL,
    /** Defined with a label in this file but not exported. */
    PRIVATE,
    /** Declared with {@code extern}; defined in another file or outside the project. */
    EXTERNAL;

    /**
     * Gets the lowercase name shown in generated documentation.
     * @return e.g. {@code "global"}.
     */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return displayName();
    }
}
