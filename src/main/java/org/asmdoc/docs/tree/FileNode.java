package org.asmdoc.docs.tree;

import java.nio.file.Path;
import java.util.List;

/**
 * The root of one file's documentation.
 *
 * @param path The documented source file.
 * @param symbols The symbol table.
 * @param defines The list of preprocessor defines.
 * @param macros The list of macros.
 */
public record FileNode(Path path, DocNode symbols, DocNode defines, DocNode macros) implements DocNode {
    @Override
    public List<DocNode> getChildren() {
        return List.of(symbols, defines, macros);
    }
}
