package org.asmdoc.docs.tree;

/**
 * A short code span, such as a symbol name.
 *
 * @param code The code text.
 */
public record InlineCodeNode(String code) implements DocNode {
}
