package org.asmdoc.docs;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A registry of the available documentation backends, looked up by name.
 */
public final class DocBackends {

    private final Map<String, DocBackend> backends = new LinkedHashMap<>();

    /**
     * Registers a backend under its {@link DocBackend#name()}.
     * @param backend The backend to register.
     */
    public void register(DocBackend backend) {
        backends.put(backend.name().toLowerCase(Locale.ROOT), backend);
    }

    /**
     * Gets a backend by name, ignoring case.
     * @param name The backend name.
     * @return The backend, or empty if none is registered under that name.
     */
    public Optional<DocBackend> get(String name) {
        return Optional.ofNullable(backends.get(name.toLowerCase(Locale.ROOT)));
    }

    public Set<String> names() {
        return backends.keySet();
    }

    /**
     * Initializes the registry with all built-in backends.
     * @return A new registry.
     */
    public static DocBackends initialize() {
        DocBackends registry = new DocBackends();
        registry.register(new MarkdownBackend());
        return registry;
    }
}
