package org.asmdoc.docs;

import org.asmdoc.docs.tree.DocNode;

import java.nio.file.Path;
import java.util.Map;

/**
 * Turns a documentation tree into the text of one output format.
 * New formats are added by implementing this interface and registering the
 * implementation in {@link DocBackends}.
 */
public interface DocBackend {

    /**
     * The name used to select this backend in the configuration.
     * @return e.g. {@code markdown}.
     */
    String name();

    /**
     * The extension of the files this backend produces, without the dot.
     * @return e.g. {@code md}.
     */
    String fileExtension();

    /**
     * Renders a documentation tree.
     *
     * @param document The tree to render.
     * @param outputPaths Maps every source file of the project to the path of its
     *                    documentation, relative to the output directory. Every file
     *                    referenced by the tree must have an entry.
     * @return The rendered text.
     * @throws IllegalArgumentException if a referenced file has no entry in {@code outputPaths}.
     */
    String render(DocNode document, Map<Path, Path> outputPaths);
}
