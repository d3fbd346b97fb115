package org.asmdoc.docs.tree;

import java.util.List;

/**
 * Items rendered as a compact list.
 *
 * @param items The child nodes in render order.
 */
public record ListNode(List<DocNode> items) implements DocNode {

    public ListNode {
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
