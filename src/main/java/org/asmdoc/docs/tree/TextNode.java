package org.asmdoc.docs.tree;

/**
 * Literal text, passed through to the backend unchanged.
 *
 * @param text The text.
 */
public record TextNode(String text) implements DocNode {
}
