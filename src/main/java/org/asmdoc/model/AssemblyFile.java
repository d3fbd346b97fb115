package org.asmdoc.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The structured model of one parsed assembly file, shaped for documentation
 * generation rather than for assembling. Instances are immutable; the parser
 * fills a {@link Builder} and calls {@link Builder#build()} once parsing succeeded.
 *
 * @param bits The target word size ({@code bits} directive, 64 by default).
 * @param includes The {@code %include} paths in file order.
 * @param globals The names declared with {@code global}.
 * @param externs The names declared with {@code extern}, in file order.
 * @param macros The macro definitions in file order.
 * @param defineDefinitions The {@code %define} directives in file order.
 * @param sections The labels and macro calls of each section, in file order within a section.
 */
public record AssemblyFile(
        int bits,
        List<Path> includes,
        Set<String> globals,
        List<String> externs,
        List<AssemblyMacro> macros,
        List<AssemblyDefine> defineDefinitions,
        Map<AssemblySection, List<AssemblyItem>> sections
) {

    /** The word size used when a file has no {@code bits} directive. */
    public static final int DEFAULT_BITS = 64;

    /**
     * Returns the names of the {@code %define} directives in file order.
     * @return The define names.
     */
    public List<String> defines() {
        return defineDefinitions.stream().map(AssemblyDefine::name).toList();
    }

    /**
     * Returns the items of one section.
     * @param section The section.
     * @return The items, or an empty list if the section was never used.
     */
    public List<AssemblyItem> itemsIn(AssemblySection section) {
        return sections.getOrDefault(section, List.of());
    }

    /**
     * Creates a new builder with default values.
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator used while a file is being parsed.
     */
    public static final class Builder {
        private int bits = DEFAULT_BITS;
        private final List<Path> includes = new ArrayList<>();
        private final Set<String> globals = new LinkedHashSet<>();
        private final List<String> externs = new ArrayList<>();
        private final List<AssemblyMacro> macros = new ArrayList<>();
        private final List<AssemblyDefine> defines = new ArrayList<>();
        private final Map<AssemblySection, List<AssemblyItem>> sections = new EnumMap<>(AssemblySection.class);

        private Builder() {}

        public Builder bits(int bits) {
            this.bits = bits;
            return this;
        }

        public Builder addInclude(Path path) {
            includes.add(path);
            return this;
        }

        public Builder addGlobal(String name) {
            globals.add(name);
            return this;
        }

        public Builder addExtern(String name) {
            externs.add(name);
            return this;
        }

        public Builder addMacro(AssemblyMacro macro) {
            macros.add(macro);
            return this;
        }

        public Builder addDefine(AssemblyDefine define) {
            defines.add(define);
            return this;
        }

        public Builder addItem(AssemblySection section, AssemblyItem item) {
            sections.computeIfAbsent(section, s -> new ArrayList<>()).add(item);
            return this;
        }

        /**
         * Freezes the accumulated state into an immutable {@link AssemblyFile}.
         * @return The file model.
         */
        public AssemblyFile build() {
            Map<AssemblySection, List<AssemblyItem>> frozenSections = new EnumMap<>(AssemblySection.class);
            sections.forEach((section, items) -> frozenSections.put(section, List.copyOf(items)));
            return new AssemblyFile(
                    bits,
                    List.copyOf(includes),
                    Collections.unmodifiableSet(new LinkedHashSet<>(globals)),
                    List.copyOf(externs),
                    List.copyOf(macros),
                    List.copyOf(defines),
                    Collections.unmodifiableMap(frozenSections));
        }
    }
}
