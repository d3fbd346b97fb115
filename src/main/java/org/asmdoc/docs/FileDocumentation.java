package org.asmdoc.docs;

import org.asmdoc.docs.tree.FileNode;

import java.nio.file.Path;

/**
 * The documentation tree generated for one source file.
 *
 * @param source The source file path as it is keyed in the project.
 * @param document The root of its documentation tree.
 */
public record FileDocumentation(Path source, FileNode document) {
}
