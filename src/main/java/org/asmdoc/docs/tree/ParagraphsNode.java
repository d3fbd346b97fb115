package org.asmdoc.docs.tree;

import java.util.List;

/**
 * Items rendered as separate paragraphs.
 *
 * @param items The child nodes in render order.
 */
public record ParagraphsNode(List<DocNode> items) implements DocNode {

    public ParagraphsNode {
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
