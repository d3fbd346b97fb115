package org.asmdoc.project;

import org.asmdoc.model.AssemblySection;

import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a file's resolved symbol table.
 *
 * @param name The symbol name.
 * @param visibility The visibility classification.
 * @param section The section the label was defined in; null for externals.
 */
public record Symbol(String name, Visibility visibility, AssemblySection section) {

    public Symbol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
    }

    /**
     * Creates the entry for an {@code extern} declaration.
     * @param name The declared name.
     * @return A symbol with {@link Visibility#EXTERNAL} and no section.
     */
    public static Symbol external(String name) {
        return new Symbol(name, Visibility.EXTERNAL, null);
    }

    public Optional<AssemblySection> definedIn() {
        return Optional.ofNullable(section);
    }
}
