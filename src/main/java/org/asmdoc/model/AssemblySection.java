package org.asmdoc.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The memory sections an item can be placed in.
 */
public enum AssemblySection {
    TEXT(".text", "text"),
    DATA(".data", "data"),
    BSS(".bss", "bss"),
    READ_ONLY_DATA(".rodata", "read-only data");

    private final String directiveName;
    private final String displayName;

    AssemblySection(String directiveName, String displayName) {
        this.directiveName = directiveName;
        this.displayName = displayName;
    }

    public String directiveName() {
        return directiveName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Looks up a section by the name used in a {@code section} directive, ignoring case.
     * @param name The section name, e.g. {@code .text}.
     * @return The section, or empty for unknown names.
     */
    public static Optional<AssemblySection> fromDirectiveName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (AssemblySection section : values()) {
            if (section.directiveName.equals(lower)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
