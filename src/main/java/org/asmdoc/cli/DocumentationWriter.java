package org.asmdoc.cli;

import org.asmdoc.docs.DocBackend;
import org.asmdoc.docs.FileDocumentation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders documentation trees with a {@link DocBackend} and writes one file per
 * source into the output directory.
 */
public class DocumentationWriter {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentationWriter.class);

    private final DocBackend backend;
    private final Path outputDirectory;

    /**
     * @param backend The renderer.
     * @param outputDirectory The directory that receives the documentation; created if missing.
     */
    public DocumentationWriter(DocBackend backend, Path outputDirectory) {
        this.backend = backend;
        this.outputDirectory = outputDirectory;
    }

    /**
     * Maps every source file to the name of its documentation file, relative to the
     * output directory: the source's stem plus the backend's extension. When two sources
     * share a stem, the later ones get a numeric suffix ({@code util-2.md}).
     *
     * @param sources The source files, in the order names are assigned.
     * @return Source path to relative output path.
     */
    public Map<Path, Path> planOutputPaths(Collection<Path> sources) {
        Map<Path, Path> outputPaths = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (Path source : sources) {
            String stem = stem(source);
            String name = stem + "." + backend.fileExtension();
            for (int n = 2; !used.add(name); n++) {
                name = stem + "-" + n + "." + backend.fileExtension();
            }
            outputPaths.put(source, Path.of(name));
        }
        return outputPaths;
    }

    /**
     * Renders and writes all documentation files.
     *
     * @param documents The documentation of every project file.
     * @return The written files.
     * @throws IOException if the directory cannot be created or a file cannot be written.
     */
    public List<Path> write(List<FileDocumentation> documents) throws IOException {
        Files.createDirectories(outputDirectory);

        List<Path> sources = new ArrayList<>();
        documents.forEach(doc -> sources.add(doc.source()));
        Map<Path, Path> outputPaths = planOutputPaths(sources);

        List<Path> written = new ArrayList<>();
        for (FileDocumentation doc : documents) {
            String text = backend.render(doc.document(), outputPaths);
            Path target = outputDirectory.resolve(outputPaths.get(doc.source()));
            Files.writeString(target, text, StandardCharsets.UTF_8);
            LOG.info("Wrote {}", target);
            written.add(target);
        }
        return written;
    }

    private static String stem(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
