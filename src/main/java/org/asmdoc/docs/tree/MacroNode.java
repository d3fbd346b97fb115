package org.asmdoc.docs.tree;

/**
 * A macro entry.
 *
 * @param name The macro name.
 * @param argCount The number of formal arguments.
 */
public record MacroNode(String name, int argCount) implements DocNode {
}
