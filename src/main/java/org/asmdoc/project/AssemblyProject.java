package org.asmdoc.project;

import org.asmdoc.diagnostics.Diagnostic;
import org.asmdoc.docs.DocumentationGenerator;
import org.asmdoc.docs.FileDocumentation;
import org.asmdoc.model.AssemblyFile;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * A whole project after cross-file resolution. Built once from a fixed set of
 * parsed files and immutable afterwards.
 */
public final class AssemblyProject {

    private final SortedMap<Path, AssemblyFile> files;
    private final Map<String, Path> globalSources;
    private final Map<String, Path> internalExterns;
    private final Map<Path, Map<String, Symbol>> symbols;
    private final Map<String, List<String>> symbolConstituents;
    private final List<Diagnostic> warnings;

    AssemblyProject(SortedMap<Path, AssemblyFile> files,
                    Map<String, Path> globalSources,
                    Map<String, Path> internalExterns,
                    Map<Path, Map<String, Symbol>> symbols,
                    Map<String, List<String>> symbolConstituents,
                    List<Diagnostic> warnings) {
        this.files = files;
        this.globalSources = globalSources;
        this.internalExterns = internalExterns;
        this.symbols = symbols;
        this.symbolConstituents = symbolConstituents;
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Resolves the given files with a fresh {@link ProjectResolver}.
     * @param files The parsed files keyed by path.
     * @return The resolved project.
     */
    public static AssemblyProject buildFrom(Map<Path, AssemblyFile> files) {
        return new ProjectResolver().resolve(files);
    }

    /**
     * Projects every file into a backend-agnostic document tree.
     * @return One entry per file, in path order.
     */
    public List<FileDocumentation> generateDocs() {
        return new DocumentationGenerator(this).generate();
    }

    public SortedMap<Path, AssemblyFile> getFiles() {
        return files;
    }

    /**
     * @return global name to the file that declares it.
     */
    public Map<String, Path> getGlobalSources() {
        return globalSources;
    }

    /**
     * @return extern name to the project file that defines it; unresolved externs are absent.
     */
    public Map<String, Path> getInternalExterns() {
        return internalExterns;
    }

    public Map<Path, Map<String, Symbol>> getSymbols() {
        return symbols;
    }

    /**
     * Returns the symbol table of one file.
     * @param file The file path.
     * @return The symbols in insertion order, or an empty map for unknown paths.
     */
    public Map<String, Symbol> symbolsOf(Path file) {
        return symbols.getOrDefault(file, Map.of());
    }

    public Map<String, List<String>> getSymbolConstituents() {
        return symbolConstituents;
    }

    /**
     * Returns the sub-labels recorded under a top-level label.
     * @param label The top-level label name.
     * @return The sub-label names in encounter order, possibly empty.
     */
    public List<String> constituentsOf(String label) {
        return symbolConstituents.getOrDefault(label, List.of());
    }

    /**
     * Finds the project file that defines an extern.
     * @param externName The extern name.
     * @return The defining file, or empty if the symbol is external to the project.
     */
    public Optional<Path> resolveExtern(String externName) {
        return Optional.ofNullable(internalExterns.get(externName));
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }
}
