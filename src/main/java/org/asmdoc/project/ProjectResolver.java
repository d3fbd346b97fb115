package org.asmdoc.project;

import org.asmdoc.api.SourceInfo;
import org.asmdoc.diagnostics.DiagnosticsEngine;
import org.asmdoc.model.AssemblyFile;
import org.asmdoc.model.AssemblyItem;
import org.asmdoc.model.AssemblySection;
import org.asmdoc.model.LabelItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Links the per-file models of a project into the tables of an {@link AssemblyProject}.
 * <p>
 * Resolution never fails. Files are processed in sorted path order so the result does
 * not depend on the order the caller collected them in. When two files declare the same
 * global, the first one in that order keeps it and the collision is reported as a warning.
 * A dotted label with no preceding top-level label in its file is reported and dropped.
 * Each call collects its own warnings; a resolver holds no state between calls.
 */
public class ProjectResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectResolver.class);

    /**
     * Resolves a complete, fixed set of files.
     * @param files The parsed files keyed by their path.
     * @return The resolved, immutable project.
     */
    public AssemblyProject resolve(Map<Path, AssemblyFile> files) {
        SortedMap<Path, AssemblyFile> sortedFiles = new TreeMap<>(files);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        Map<String, Path> globalSources = collectGlobals(sortedFiles, diagnostics);
        Map<String, Path> internalExterns = linkExterns(sortedFiles, globalSources);

        Map<Path, Map<String, Symbol>> symbols = new LinkedHashMap<>();
        Map<String, List<String>> constituents = new LinkedHashMap<>();
        sortedFiles.forEach((path, file) -> symbols.put(path, buildSymbolTable(path, file, constituents, diagnostics)));

        return new AssemblyProject(
                Collections.unmodifiableSortedMap(sortedFiles),
                freeze(globalSources),
                freeze(internalExterns),
                freezeNested(symbols),
                freezeLists(constituents),
                diagnostics.getWarnings());
    }

    private Map<String, Path> collectGlobals(SortedMap<Path, AssemblyFile> files, DiagnosticsEngine diagnostics) {
        Map<String, Path> globalSources = new LinkedHashMap<>();
        files.forEach((path, file) -> {
            for (String global : file.globals()) {
                Path owner = globalSources.putIfAbsent(global, path);
                if (owner != null && !owner.equals(path)) {
                    LOG.warn("Global '{}' is declared in both {} and {}; keeping {}", global, owner, path, owner);
                    diagnostics.reportWarning(
                            "Global '" + global + "' is already declared in " + owner,
                            locateLabel(path, file, global));
                }
            }
        });
        return globalSources;
    }

    private Map<String, Path> linkExterns(SortedMap<Path, AssemblyFile> files, Map<String, Path> globalSources) {
        Map<String, Path> internalExterns = new LinkedHashMap<>();
        for (AssemblyFile file : files.values()) {
            for (String name : file.externs()) {
                Path definingFile = globalSources.get(name);
                if (definingFile != null) {
                    internalExterns.put(name, definingFile);
                }
            }
        }
        return internalExterns;
    }

    /**
     * Builds one file's symbol table and appends its sub-labels to the project-wide constituents.
     * The owning label is a fold accumulator local to this file.
     */
    private Map<String, Symbol> buildSymbolTable(Path path, AssemblyFile file, Map<String, List<String>> constituents,
                                                 DiagnosticsEngine diagnostics) {
        Map<String, Symbol> table = new LinkedHashMap<>();
        for (String name : file.externs()) {
            table.put(name, Symbol.external(name));
        }

        String currentLabel = null;
        for (AssemblySection section : AssemblySection.values()) {
            for (AssemblyItem item : file.itemsIn(section)) {
                if (!(item instanceof LabelItem label)) {
                    continue;
                }
                if (label.isSubLabel()) {
                    if (currentLabel == null) {
                        LOG.warn("Sub-label '{}' in {} has no enclosing label", label.name(), path);
                        diagnostics.reportWarning("Sub-label '" + label.name() + "' has no enclosing label", label.source());
                    } else {
                        constituents.computeIfAbsent(currentLabel, k -> new ArrayList<>()).add(label.name());
                    }
                    continue;
                }
                currentLabel = label.name();
                Visibility visibility = file.globals().contains(label.name()) ? Visibility.GLOBAL : Visibility.PRIVATE;
                table.put(label.name(), new Symbol(label.name(), visibility, section));
            }
        }
        return table;
    }

    private static SourceInfo locateLabel(Path path, AssemblyFile file, String name) {
        for (AssemblySection section : AssemblySection.values()) {
            for (AssemblyItem item : file.itemsIn(section)) {
                if (item instanceof LabelItem label && label.name().equals(name)) {
                    return label.source();
                }
            }
        }
        return new SourceInfo(path.toString(), 0, 0);
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private static Map<Path, Map<String, Symbol>> freezeNested(Map<Path, Map<String, Symbol>> map) {
        Map<Path, Map<String, Symbol>> copy = new LinkedHashMap<>();
        map.forEach((path, table) -> copy.put(path, freeze(table)));
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, List<String>> freezeLists(Map<String, List<String>> map) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        map.forEach((label, subLabels) -> copy.put(label, List.copyOf(subLabels)));
        return Collections.unmodifiableMap(copy);
    }
}
