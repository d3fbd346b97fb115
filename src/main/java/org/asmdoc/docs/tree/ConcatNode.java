package org.asmdoc.docs.tree;

import java.util.List;

/**
 * Items rendered back to back on one line.
 *
 * @param items The child nodes in render order.
 */
public record ConcatNode(List<DocNode> items) implements DocNode {

    public ConcatNode {
        items = List.copyOf(items);
    }

    @Override
    public List<DocNode> getChildren() {
        return items;
    }

    @Override
    public boolean isEmpty() {
        return items.isEmpty();
    }
}
