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
import org.asmdoc.docs.tree.TableNode;
import org.asmdoc.docs.tree.TextNode;
import org.asmdoc.model.AssemblyFile;
import org.asmdoc.model.AssemblyMacro;
import org.asmdoc.model.AssemblySection;
import org.asmdoc.project.AssemblyProject;
import org.asmdoc.project.Symbol;
import org.asmdoc.project.Visibility;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Projects a resolved {@link AssemblyProject} into one documentation tree per file.
 * <p>
 * The symbol table has the columns {@code Visibility | Name | Section | Defined in}.
 * The name cell lists the label followed by its indented sub-labels; the last
 * column links resolved externs to the file that defines them.
 */
public class DocumentationGenerator {

    static final List<String> SYMBOL_COLUMNS = List.of("Visibility", "Name", "Section", "Defined in");
    static final String SUB_LABEL_INDENT = "&emsp;";
    static final String UNRESOLVED = "unresolved";

    private final AssemblyProject project;

    /**
     * @param project The resolved project to document.
     */
    public DocumentationGenerator(AssemblyProject project) {
        this.project = project;
    }

    /**
     * Generates the documentation of every file, in path order.
     * @return The documentation trees.
     */
    public List<FileDocumentation> generate() {
        List<FileDocumentation> result = new ArrayList<>();
        for (Map.Entry<Path, AssemblyFile> entry : project.getFiles().entrySet()) {
            result.add(new FileDocumentation(entry.getKey(), document(entry.getKey(), entry.getValue())));
        }
        return result;
    }

    private FileNode document(Path path, AssemblyFile file) {
        return new FileNode(path, symbolTable(path), defines(file), macros(file));
    }

    private DocNode symbolTable(Path path) {
        List<DocNode> header = new ArrayList<>();
        SYMBOL_COLUMNS.forEach(column -> header.add(new TextNode(column)));

        List<List<DocNode>> rows = new ArrayList<>();
        for (Symbol symbol : project.symbolsOf(path).values()) {
            rows.add(List.of(
                    new TextNode(symbol.visibility().displayName()),
                    nameCell(symbol),
                    new TextNode(symbol.definedIn().map(AssemblySection::displayName).orElse("")),
                    definedInCell(symbol)));
        }
        return new TableNode(header, rows);
    }

    private DocNode nameCell(Symbol symbol) {
        DocNode name = new InlineCodeNode(symbol.name());
        if (symbol.visibility() == Visibility.EXTERNAL) {
            return name;
        }
        List<String> subLabels = project.constituentsOf(symbol.name());
        if (subLabels.isEmpty()) {
            return name;
        }
        List<DocNode> lines = new ArrayList<>();
        lines.add(name);
        for (String subLabel : subLabels) {
            lines.add(new ConcatNode(List.of(new TextNode(SUB_LABEL_INDENT), new InlineCodeNode(subLabel))));
        }
        return new CellLinesNode(lines);
    }

    private DocNode definedInCell(Symbol symbol) {
        if (symbol.visibility() != Visibility.EXTERNAL) {
            return new TextNode("");
        }
        Optional<Path> definingFile = project.resolveExtern(symbol.name());
        return definingFile.<DocNode>map(FileReferenceNode::new).orElseGet(() -> new TextNode(UNRESOLVED));
    }

    private DocNode defines(AssemblyFile file) {
        List<DocNode> items = new ArrayList<>();
        file.defines().forEach(name -> items.add(new DefineNode(name)));
        return new ListNode(items);
    }

    private DocNode macros(AssemblyFile file) {
        List<DocNode> items = new ArrayList<>();
        for (AssemblyMacro macro : file.macros()) {
            items.add(new MacroNode(macro.name(), macro.argCount()));
        }
        return new ListNode(items);
    }
}
