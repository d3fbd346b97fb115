package org.asmdoc.docs.tree;

import java.util.List;

/**
 * Items rendered as separate lines within one table cell.
 *
 * @param items The child nodes in render order.
 */
public record CellLinesNode(List<DocNode> items) implements DocNode {

    public CellLinesNode {
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
