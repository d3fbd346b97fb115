package org.asmdoc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The typed view of the {@code asmdoc} configuration block.
 *
 * @param outputDirectory Where documentation files are written.
 * @param extensions File extensions (without dot, lowercase) selected from directories.
 * @param syntax The front-end dialect name.
 * @param backend The documentation backend name.
 * @param parserThreads Number of worker threads used to parse files.
 * @param onParseError What to do when files fail to load.
 */
public record AsmdocOptions(
        Path outputDirectory,
        List<String> extensions,
        String syntax,
        String backend,
        int parserThreads,
        ParseErrorPolicy onParseError
) {
    static final String ROOT = "asmdoc";

    public AsmdocOptions {
        extensions = List.copyOf(extensions);
    }

    /**
     * Reads the options from a resolved configuration.
     *
     * @param config The configuration, including the {@code reference.conf} defaults.
     * @return The options.
     * @throws ConfigException if a key is missing or has an invalid value.
     */
    public static AsmdocOptions fromConfig(Config config) {
        Config asmdoc = config.getConfig(ROOT);

        int threads = asmdoc.getInt("parser-threads");
        if (threads < 1) {
            throw new ConfigException.BadValue(asmdoc.origin(), ROOT + ".parser-threads",
                    "must be at least 1, was " + threads);
        }

        List<String> extensions = new ArrayList<>();
        for (String extension : asmdoc.getStringList("extensions")) {
            String normalized = extension.startsWith(".") ? extension.substring(1) : extension;
            if (normalized.isBlank()) {
                throw new ConfigException.BadValue(asmdoc.origin(), ROOT + ".extensions", "contains an empty extension");
            }
            extensions.add(normalized.toLowerCase(Locale.ROOT));
        }
        if (extensions.isEmpty()) {
            throw new ConfigException.BadValue(asmdoc.origin(), ROOT + ".extensions", "must not be empty");
        }

        return new AsmdocOptions(
                Path.of(asmdoc.getString("output-directory")),
                extensions,
                asmdoc.getString("syntax"),
                asmdoc.getString("backend"),
                threads,
                asmdoc.getEnum(ParseErrorPolicy.class, "on-parse-error"));
    }

    /**
     * Returns a copy with a different output directory.
     * @param directory The new output directory.
     * @return The updated options.
     */
    public AsmdocOptions withOutputDirectory(Path directory) {
        return new AsmdocOptions(directory, extensions, syntax, backend, parserThreads, onParseError);
    }
}
