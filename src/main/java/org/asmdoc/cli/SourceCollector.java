package org.asmdoc.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands the input paths given on the command line into the sorted list of
 * source files to document. Directories are walked recursively and filtered by
 * extension; files named explicitly must also carry a known extension.
 */
public class SourceCollector {

    private static final Logger LOG = LoggerFactory.getLogger(SourceCollector.class);

    private final List<String> extensions;

    /**
     * @param extensions The accepted extensions, without the dot.
     */
    public SourceCollector(List<String> extensions) {
        this.extensions = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Collects the source files.
     *
     * @param inputs Files or directories.
     * @return The matching files, normalized, de-duplicated and sorted.
     * @throws IOException if a directory cannot be walked.
     */
    public List<Path> collect(List<Path> inputs) throws IOException {
        SortedSet<Path> sources = new TreeSet<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> stream = walk(input)) {
                    stream.filter(Files::isRegularFile)
                            .filter(this::hasSourceExtension)
                            .map(Path::normalize)
                            .forEach(sources::add);
                } catch (UncheckedIOException e) {
                    // Entries that fail while the stream is consumed, such as unreadable subdirectories.
                    throw e.getCause();
                }
            } else if (Files.isRegularFile(input)) {
                if (hasSourceExtension(input)) {
                    sources.add(input.normalize());
                } else {
                    LOG.debug("Skipping {}: not an assembly source", input);
                }
            } else {
                LOG.warn("Input path {} does not exist", input);
            }
        }
        return new ArrayList<>(sources);
    }

    Stream<Path> walk(Path directory) throws IOException {
        return Files.walk(directory);
    }

    boolean hasSourceExtension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return false;
        }
        return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
