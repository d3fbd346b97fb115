package org.asmdoc.docs.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * A table with a header row. A table without body rows is empty.
 *
 * @param header The header cells.
 * @param rows The body rows; each row has one cell per header cell.
 */
public record TableNode(List<DocNode> header, List<List<DocNode>> rows) implements DocNode {

    public TableNode {
        header = List.copyOf(header);
        List<List<DocNode>> copy = new ArrayList<>();
        for (List<DocNode> row : rows) {
            if (row.size() != header.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " cells but the header has " + header.size());
            }
            copy.add(List.copyOf(row));
        }
        rows = List.copyOf(copy);
    }

    @Override
    public List<DocNode> getChildren() {
        List<DocNode> children = new ArrayList<>(header);
        rows.forEach(children::addAll);
        return children;
    }

    @Override
    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
