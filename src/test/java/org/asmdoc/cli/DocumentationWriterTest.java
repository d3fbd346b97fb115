package org.asmdoc.cli;

import org.asmdoc.docs.DocBackend;
import org.asmdoc.docs.FileDocumentation;
import org.asmdoc.docs.tree.FileNode;
import org.asmdoc.docs.tree.ListNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the {@link DocumentationWriter}.
 */
@ExtendWith(MockitoExtension.class)
class DocumentationWriterTest {

    @TempDir
    Path tempDir;

    @Mock
    DocBackend backend;

    private static FileDocumentation emptyDoc(Path source) {
        ListNode empty = new ListNode(List.of());
        return new FileDocumentation(source, new FileNode(source, empty, empty, empty));
    }

    @Test
    @Tag("unit")
    void plansStemBasedNamesAndSuffixesCollisions() {
        // Arrange
        when(backend.fileExtension()).thenReturn("md");
        DocumentationWriter writer = new DocumentationWriter(backend, tempDir);

        // Act
        Map<Path, Path> plan = writer.planOutputPaths(List.of(
                Path.of("a/util.asm"), Path.of("b/util.nasm"), Path.of("main.asm"), Path.of("c/util.asm"), Path.of("Makefile")));

        // Assert
        assertThat(plan).containsExactly(
                entry(Path.of("a/util.asm"), Path.of("util.md")),
                entry(Path.of("b/util.nasm"), Path.of("util-2.md")),
                entry(Path.of("main.asm"), Path.of("main.md")),
                entry(Path.of("c/util.asm"), Path.of("util-3.md")),
                entry(Path.of("Makefile"), Path.of("Makefile.md")));
    }

    @Test
    @Tag("unit")
    void writesRenderedTextIntoCreatedOutputDirectory() throws IOException {
        // Arrange
        Path output = tempDir.resolve("out/docs");
        FileDocumentation main = emptyDoc(Path.of("src/main.asm"));
        FileDocumentation lib = emptyDoc(Path.of("src/lib.asm"));
        when(backend.fileExtension()).thenReturn("md");
        when(backend.render(eq(main.document()), anyMap())).thenReturn("main docs");
        when(backend.render(eq(lib.document()), anyMap())).thenReturn("lib docs");

        // Act
        List<Path> written = new DocumentationWriter(backend, output).write(List.of(main, lib));

        // Assert
        assertThat(written).containsExactly(output.resolve("main.md"), output.resolve("lib.md"));
        assertThat(Files.readString(output.resolve("main.md"))).isEqualTo("main docs");
        assertThat(Files.readString(output.resolve("lib.md"))).isEqualTo("lib docs");
    }

    @Test
    @Tag("unit")
    void passesCompleteOutputMapToBackend() throws IOException {
        // Arrange
        FileDocumentation main = emptyDoc(Path.of("main.asm"));
        FileDocumentation lib = emptyDoc(Path.of("lib.asm"));
        when(backend.fileExtension()).thenReturn("md");
        when(backend.render(any(), anyMap())).thenReturn("");

        // Act
        new DocumentationWriter(backend, tempDir).write(List.of(main, lib));

        // Assert
        Map<Path, Path> expected = Map.of(Path.of("main.asm"), Path.of("main.md"), Path.of("lib.asm"), Path.of("lib.md"));
        verify(backend).render(main.document(), expected);
        verify(backend).render(lib.document(), expected);
    }
}
