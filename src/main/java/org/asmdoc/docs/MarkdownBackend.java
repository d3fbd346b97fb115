package org.asmdoc.docs;

import org.asmdoc.docs.tree.CellLinesNode;
import org.asmdoc.docs.tree.ConcatNode;
import org.asmdoc.docs.tree.DefineNode;
import org.asmdoc.docs.tree.DocNode;
import org.asmdoc.docs.tree.FileNode;
import org.asmdoc.docs.tree.FileReferenceNode;
import org.asmdoc.docs.tree.InlineCodeNode;
import org.asmdoc.docs.tree.ListNode;
import org.asmdoc.docs.tree.MacroNode;
import org.asmdoc.docs.tree.ParagraphsNode;
import org.asmdoc.docs.tree.TableNode;
import org.asmdoc.docs.tree.TextNode;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders documentation trees as GitHub-flavoured Markdown.
 */
public class MarkdownBackend implements DocBackend {

    static final String BANNER =
            "<!-- This file was generated by asmdoc <https://github.com/ethanuppal/asmdoc>. -->";

    @Override
    public String name() {
        return "markdown";
    }

    @Override
    public String fileExtension() {
        return "md";
    }

    @Override
    public String render(DocNode document, Map<Path, Path> outputPaths) {
        StringBuilder out = new StringBuilder();
        write(document, out, outputPaths);
        return out.toString();
    }

    private void write(DocNode node, StringBuilder out, Map<Path, Path> outputPaths) {
        if (node instanceof FileNode file) {
            writeFile(file, out, outputPaths);
        } else if (node instanceof ParagraphsNode paragraphs) {
            for (DocNode item : paragraphs.items()) {
                out.append("- ");
                write(item, out, outputPaths);
                out.append("\n\n");
            }
        } else if (node instanceof ListNode list) {
            for (DocNode item : list.items()) {
                out.append("- ");
                write(item, out, outputPaths);
                out.append('\n');
            }
        } else if (node instanceof TableNode table) {
            writeTable(table, out, outputPaths);
        } else if (node instanceof MacroNode macro) {
            out.append('`').append(macro.name()).append("` (")
                    .append(macro.argCount()).append(" argument")
                    .append(macro.argCount() == 1 ? "" : "s").append(')');
        } else if (node instanceof DefineNode define) {
            out.append('`').append(define.name()).append('`');
        } else if (node instanceof InlineCodeNode code) {
            out.append('`').append(code.code()).append('`');
        } else if (node instanceof TextNode text) {
            out.append(text.text());
        } else if (node instanceof CellLinesNode lines) {
            for (int i = 0; i < lines.items().size(); i++) {
                if (i > 0) out.append("<br>");
                write(lines.items().get(i), out, outputPaths);
            }
        } else if (node instanceof FileReferenceNode reference) {
            Path target = outputPaths.get(reference.source());
            if (target == null) {
                throw new IllegalArgumentException("No output path for referenced file " + reference.source());
            }
            out.append('[').append(reference.source().getFileName()).append("](")
                    .append(toLink(target)).append(')');
        } else if (node instanceof ConcatNode concat) {
            concat.items().forEach(item -> write(item, out, outputPaths));
        } else {
            throw new IllegalArgumentException("Unsupported documentation node: " + node.getClass().getSimpleName());
        }
    }

    private void writeFile(FileNode file, StringBuilder out, Map<Path, Path> outputPaths) {
        out.append(BANNER).append('\n');
        out.append("# ").append(file.path().getFileName()).append("\n\n");
        writeSection("Symbols", file.symbols(), out, outputPaths);
        writeSection("Defines", file.defines(), out, outputPaths);
        writeSection("Macros", file.macros(), out, outputPaths);
    }

    private void writeSection(String title, DocNode content, StringBuilder out, Map<Path, Path> outputPaths) {
        if (content.isEmpty()) {
            return;
        }
        out.append("## ").append(title).append('\n');
        write(content, out, outputPaths);
        out.append('\n');
    }

    private void writeTable(TableNode table, StringBuilder out, Map<Path, Path> outputPaths) {
        out.append('\n');
        writeRow(table.header(), out, outputPaths);
        out.append('|');
        for (int i = 0; i < table.header().size(); i++) {
            out.append(" --- |");
        }
        out.append('\n');
        for (List<DocNode> row : table.rows()) {
            writeRow(row, out, outputPaths);
        }
    }

    private void writeRow(List<DocNode> cells, StringBuilder out, Map<Path, Path> outputPaths) {
        out.append('|');
        for (DocNode cell : cells) {
            out.append(' ');
            write(cell, out, outputPaths);
            out.append(" |");
        }
        out.append('\n');
    }

    // Markdown links always use forward slashes.
    private static String toLink(Path target) {
        return target.toString().replace('\\', '/');
    }
}
