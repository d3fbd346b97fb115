package org.asmdoc.docs.tree;

import java.nio.file.Path;

/**
 * A link to the documentation of another source file of the project. The backend
 * looks the target up in the source-to-output path map when rendering.
 *
 * @param source The referenced source file.
 */
public record FileReferenceNode(Path source) implements DocNode {
}
