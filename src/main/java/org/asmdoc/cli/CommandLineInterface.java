package org.asmdoc.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.asmdoc.api.ISyntax;
import org.asmdoc.config.ConfigLoader;
import org.asmdoc.config.LoggingConfigurator;
import org.asmdoc.diagnostics.Diagnostic;
import org.asmdoc.docs.DocBackend;
import org.asmdoc.docs.DocBackends;
import org.asmdoc.frontend.SyntaxRegistry;
import org.asmdoc.project.AssemblyProject;
import org.asmdoc.project.ProjectResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * The {@code asmdoc} command: parses the given NASM sources, resolves them as one
 * project and writes one documentation file per source.
 * <p>
 * Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_FAILURES} if files could not
 * be loaded under the {@code ABORT} policy or output could not be written,
 * {@value #EXIT_STARTUP} for startup failures such as a bad configuration or an
 * output path that is not a directory.
 */
@Command(
    name = "asmdoc",
    mixinStandardHelpOptions = true,
    version = "asmdoc 1.0",
    description = "Generates symbol documentation for NASM assembly projects."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_STARTUP = 2;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: docs)")
    private Path outputDirectory;

    @Option(names = {"-c", "--config"}, description = "Path to a configuration file (default: asmdoc.conf)")
    private Path configFile;

    @Parameters(arity = "1..*", paramLabel = "PATH", description = "Source files or directories to document")
    private List<Path> paths;

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        System.exit(commandLine.execute(args));
    }

    @Override
    public Integer call() {
        final AsmdocOptions options;
        try {
            final Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            options = resolveOutput(AsmdocOptions.fromConfig(config));
        } catch (ConfigException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_STARTUP;
        }

        final Path output = options.outputDirectory();
        if (Files.exists(output) && !Files.isDirectory(output)) {
            LOG.error("Output path {} exists but is not a directory", output);
            return EXIT_STARTUP;
        }
        final Optional<ISyntax> syntax = SyntaxRegistry.initialize().get(options.syntax());
        if (syntax.isEmpty()) {
            LOG.error("Unknown syntax '{}'", options.syntax());
            return EXIT_STARTUP;
        }
        final Optional<DocBackend> backend = DocBackends.initialize().get(options.backend());
        if (backend.isEmpty()) {
            LOG.error("Unknown documentation backend '{}'", options.backend());
            return EXIT_STARTUP;
        }

        try {
            return run(options, syntax.get(), backend.get());
        } catch (IOException e) {
            LOG.error("I/O failure: {}", e.toString());
            return EXIT_FAILURES;
        }
    }

    private AsmdocOptions resolveOutput(final AsmdocOptions options) {
        return outputDirectory != null ? options.withOutputDirectory(outputDirectory) : options;
    }

    private int run(final AsmdocOptions options, final ISyntax syntax, final DocBackend backend) throws IOException {
        final List<Path> sources = new SourceCollector(options.extensions()).collect(paths);
        if (sources.isEmpty()) {
            LOG.warn("No source files with extensions {} found", options.extensions());
        }

        final ProjectLoader.Result loaded = new ProjectLoader(syntax, options.parserThreads()).load(sources);
        if (loaded.hasFailures()) {
            if (options.onParseError() == ParseErrorPolicy.ABORT) {
                LOG.error("{} of {} file(s) failed to load; no documentation written", loaded.failures().size(), sources.size());
                return EXIT_FAILURES;
            }
            LOG.warn("Skipping {} file(s) that failed to load", loaded.failures().size());
        }

        final AssemblyProject project = new ProjectResolver().resolve(loaded.files());
        for (final Diagnostic warning : project.getWarnings()) {
            LOG.debug("{}", warning);
        }

        final List<Path> written = new DocumentationWriter(backend, options.outputDirectory()).write(project.generateDocs());
        LOG.info("Documented {} file(s) in {}", written.size(), options.outputDirectory());
        return EXIT_OK;
    }
}
