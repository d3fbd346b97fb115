package org.asmdoc.docs.tree;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of a documentation tree. The tree is
 * backend-agnostic; a {@link org.asmdoc.docs.DocBackend} turns it into text.
 */
public interface DocNode {
    /**
     * Returns a list of the direct child nodes.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<DocNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Whether the node would render to nothing useful. Renderers skip empty sections.
     *
     * @return true if the node has no content.
     */
    default boolean isEmpty() {
        return false;
    }
}
