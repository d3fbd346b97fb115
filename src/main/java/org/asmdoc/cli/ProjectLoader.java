package org.asmdoc.cli;

import org.asmdoc.api.ISyntax;
import org.asmdoc.api.ParseException;
import org.asmdoc.model.AssemblyFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Reads and parses source files on a fixed pool of worker threads.
 * <p>
 * Every parse owns its result; nothing is shared between workers. All results are
 * gathered before {@link #load(List)} returns, so the caller can resolve the project
 * from a complete set. A failing file does not affect the others.
 */
public class ProjectLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectLoader.class);

    private final ISyntax syntax;
    private final int threads;

    /**
     * @param syntax The front end used for every file.
     * @param threads The number of worker threads, at least 1.
     */
    public ProjectLoader(ISyntax syntax, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, was " + threads);
        }
        this.syntax = syntax;
        this.threads = threads;
    }

    /**
     * The outcome of loading a set of files.
     *
     * @param files The successfully parsed files, in input order.
     * @param failures The files that failed, in input order.
     */
    public record Result(Map<Path, AssemblyFile> files, List<LoadFailure> failures) {
        public Result {
            files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
            failures = List.copyOf(failures);
        }

        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }

    private record Outcome(Path file, AssemblyFile model, LoadFailure failure) {
    }

    /**
     * Loads all files.
     *
     * @param sources The files to read and parse.
     * @return The parsed files and the failures.
     */
    public Result load(List<Path> sources) {
        if (sources.isEmpty()) {
            return new Result(Map.of(), List.of());
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, sources.size()));
        try {
            List<CompletableFuture<Outcome>> futures = new ArrayList<>();
            for (Path source : sources) {
                futures.add(CompletableFuture.supplyAsync(() -> loadOne(source), executor));
            }

            Map<Path, AssemblyFile> files = new LinkedHashMap<>();
            List<LoadFailure> failures = new ArrayList<>();
            for (CompletableFuture<Outcome> future : futures) {
                Outcome outcome = future.join();
                if (outcome.failure() != null) {
                    failures.add(outcome.failure());
                } else {
                    files.put(outcome.file(), outcome.model());
                }
            }
            return new Result(files, failures);
        } finally {
            executor.shutdown();
        }
    }

    private Outcome loadOne(Path source) {
        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            LOG.error("Failed to read {}: not valid UTF-8 text", source);
            return new Outcome(source, null, new LoadFailure(source, LoadFailure.Kind.IO, "not valid UTF-8 text"));
        } catch (IOException e) {
            LOG.error("Failed to read {}: {}", source, e.toString());
            return new Outcome(source, null, new LoadFailure(source, LoadFailure.Kind.IO, e.toString()));
        }

        try {
            LOG.debug("Parsing {}", source);
            return new Outcome(source, syntax.parse(text, source.toString()), null);
        } catch (ParseException e) {
            LOG.error("Failed to parse {}: {}", source, e.getMessage());
            return new Outcome(source, null, new LoadFailure(source, LoadFailure.Kind.PARSE, e.getMessage()));
        }
    }
}
