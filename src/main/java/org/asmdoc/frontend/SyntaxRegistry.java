package org.asmdoc.frontend;

import org.asmdoc.api.ISyntax;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A registry of assembly dialect front ends, looked up by name.
 */
public final class SyntaxRegistry {

    private final Map<String, ISyntax> syntaxes = new LinkedHashMap<>();

    /**
     * Registers a front end under its {@link ISyntax#name()}.
     * @param syntax The front end.
     */
    public void register(ISyntax syntax) {
        syntaxes.put(syntax.name().toLowerCase(Locale.ROOT), syntax);
    }

    /**
     * Gets a front end by name, ignoring case.
     * @param name The dialect name.
     * @return The front end, or empty if the dialect is unknown.
     */
    public Optional<ISyntax> get(String name) {
        return Optional.ofNullable(syntaxes.get(name.toLowerCase(Locale.ROOT)));
    }

    public Set<String> names() {
        return syntaxes.keySet();
    }

    /**
     * Initializes the registry with all built-in front ends.
     * @return A new registry.
     */
    public static SyntaxRegistry initialize() {
        SyntaxRegistry registry = new SyntaxRegistry();
        registry.register(new NasmSyntax());
        return registry;
    }
}
