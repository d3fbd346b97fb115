package org.asmdoc.docs.tree;

/**
 * A preprocessor define entry.
 *
 * @param name The define name.
 */
public record DefineNode(String name) implements DocNode {
}
