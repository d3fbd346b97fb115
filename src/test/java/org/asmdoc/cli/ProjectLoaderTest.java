package org.asmdoc.cli;

import org.asmdoc.api.ISyntax;
import org.asmdoc.frontend.NasmSyntax;
import org.asmdoc.junit.extensions.logging.ExpectLog;
import org.asmdoc.junit.extensions.logging.LogLevel;
import org.asmdoc.junit.extensions.logging.LogWatchExtension;
import org.asmdoc.model.AssemblyFile;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the {@link ProjectLoader}: concurrent parsing and the separation of
 * read failures from parse failures.
 */
@ExtendWith(LogWatchExtension.class)
class ProjectLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }

    @Test
    @Tag("unit")
    void parsesEveryFileInInputOrder() throws IOException {
        // Arrange
        List<Path> sources = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            sources.add(write("f" + i + ".asm", "global f" + i + "\nf" + i + ":\n"));
        }

        // Act
        ProjectLoader.Result result = new ProjectLoader(new NasmSyntax(), 3).load(sources);

        // Assert
        assertThat(result.hasFailures()).isFalse();
        assertThat(result.files().keySet()).containsExactlyElementsOf(sources);
        assertThat(result.files().get(sources.get(7)).globals()).containsExactly("f7");
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*ProjectLoader", messagePattern = "Failed to parse .*bad\\.asm: .*Invalid syntax")
    void reportsParseFailuresWithoutAffectingOtherFiles() throws IOException {
        // Arrange
        Path good = write("good.asm", "main:\n");
        Path bad = write("bad.asm", "section .bogus\n");

        // Act
        ProjectLoader.Result result = new ProjectLoader(new NasmSyntax(), 2).load(List.of(good, bad));

        // Assert
        assertThat(result.files()).containsOnlyKeys(good);
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.file()).isEqualTo(bad);
            assertThat(failure.kind()).isEqualTo(LoadFailure.Kind.PARSE);
            assertThat(failure.message()).isEqualTo(
                    "parse(bad.asm:1:1) > section(bad.asm:1:1) > NEWLINE(bad.asm:1:15): Invalid syntax");
        });
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to read .*latin1\\.asm: not valid UTF-8 text")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to read .*missing\\.asm: .*")
    void reportsUnreadableFilesAsIoFailures() throws IOException {
        // Arrange
        Path latin1 = Files.write(tempDir.resolve("latin1.asm"), new byte[]{'m', (byte) 0xE9, ':', '\n'});
        Path missing = tempDir.resolve("missing.asm");

        // Act
        ProjectLoader.Result result = new ProjectLoader(new NasmSyntax(), 1).load(List.of(latin1, missing));

        // Assert
        assertThat(result.files()).isEmpty();
        assertThat(result.failures()).extracting(LoadFailure::file, LoadFailure::kind).containsExactly(
                tuple(latin1, LoadFailure.Kind.IO),
                tuple(missing, LoadFailure.Kind.IO));
    }

    @Test
    @Tag("unit")
    void passesPathAsLogicalFileName() throws Exception {
        // Arrange
        Path source = write("x.asm", "ret\n");
        ISyntax syntax = mock(ISyntax.class);
        AssemblyFile model = AssemblyFile.builder().build();
        when(syntax.parse(anyString(), anyString())).thenReturn(model);

        // Act
        ProjectLoader.Result result = new ProjectLoader(syntax, 4).load(List.of(source));

        // Assert
        verify(syntax, times(1)).parse(eq("ret\n"), eq(source.toString()));
        assertThat(result.files()).containsEntry(source, model);
    }

    @Test
    @Tag("unit")
    void returnsEmptyResultForNoSources() {
        ProjectLoader.Result result = new ProjectLoader(new NasmSyntax(), 2).load(List.of());

        assertThat(result.files()).isEmpty();
        assertThat(result.failures()).isEmpty();
    }

    @Test
    @Tag("unit")
    void rejectsNonPositiveThreadCount() {
        assertThatThrownBy(() -> new ProjectLoader(new NasmSyntax(), 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
