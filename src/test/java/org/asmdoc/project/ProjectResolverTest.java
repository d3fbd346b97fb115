package org.asmdoc.project;

import org.asmdoc.api.ParseException;
import org.asmdoc.diagnostics.Diagnostic;
import org.asmdoc.frontend.NasmSyntax;
import org.asmdoc.junit.extensions.logging.ExpectLog;
import org.asmdoc.junit.extensions.logging.LogLevel;
import org.asmdoc.junit.extensions.logging.LogWatchExtension;
import org.asmdoc.model.AssemblyFile;
import org.asmdoc.model.AssemblySection;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link ProjectResolver}.
 * These tests verify visibility classification, extern linking, sub-label grouping
 * and the handling of duplicate globals and orphan sub-labels.
 */
@ExtendWith(LogWatchExtension.class)
public class ProjectResolverTest {

    private static final Path A = Path.of("src/a.asm");
    private static final Path B = Path.of("src/b.asm");

    private static AssemblyFile parse(Path path, String... lines) throws ParseException {
        return new NasmSyntax().parse(String.join("\n", lines) + "\n", path.toString());
    }

    /**
     * Verifies that a global defined in one file and declared extern in another is classified
     * on both sides and that the extern is linked to the defining file.
     */
    @Test
    @Tag("unit")
    void testVisibilityClassification() throws ParseException {
        // Arrange
        Map<Path, AssemblyFile> files = Map.of(
                A, parse(A, "global foo", "section .text", "foo:", "helper:", "    ret"),
                B, parse(B, "extern foo", "main:", "    call foo"));

        // Act
        AssemblyProject project = new ProjectResolver().resolve(files);

        // Assert
        assertThat(project.symbolsOf(A)).containsExactly(
                entry("foo", new Symbol("foo", Visibility.GLOBAL, AssemblySection.TEXT)),
                entry("helper", new Symbol("helper", Visibility.PRIVATE, AssemblySection.TEXT)));
        assertThat(project.symbolsOf(B)).containsExactly(
                entry("foo", Symbol.external("foo")),
                entry("main", new Symbol("main", Visibility.PRIVATE, AssemblySection.TEXT)));
        assertThat(project.getGlobalSources()).containsExactly(entry("foo", A));
        assertThat(project.getInternalExterns()).containsExactly(entry("foo", A));
        assertThat(project.resolveExtern("foo")).contains(A);
        assertThat(project.getWarnings()).isEmpty();
    }

    /**
     * Verifies that dotted labels are grouped under the preceding top-level label and
     * do not appear in the file's symbol table.
     */
    @Test
    @Tag("unit")
    void testSubLabelGrouping() throws ParseException {
        // Arrange
        Map<Path, AssemblyFile> files = Map.of(A, parse(A, "label:", ".sub1:", ".sub2:", "other:", ".sub3:"));

        // Act
        AssemblyProject project = AssemblyProject.buildFrom(files);

        // Assert
        assertThat(project.constituentsOf("label")).containsExactly(".sub1", ".sub2");
        assertThat(project.constituentsOf("other")).containsExactly(".sub3");
        assertThat(project.symbolsOf(A)).containsOnlyKeys("label", "other");
    }

    /**
     * Verifies that an extern without a project-wide global stays unresolved but is listed.
     */
    @Test
    @Tag("unit")
    void testUnresolvedExtern() throws ParseException {
        // Act
        AssemblyProject project = AssemblyProject.buildFrom(Map.of(A, parse(A, "extern printf", "main:")));

        // Assert
        assertThat(project.getInternalExterns()).doesNotContainKey("printf");
        assertThat(project.resolveExtern("printf")).isEmpty();
        assertThat(project.symbolsOf(A).get("printf")).isEqualTo(Symbol.external("printf"));
        assertThat(project.symbolsOf(A).get("printf").definedIn()).isEmpty();
    }

    /**
     * Verifies that resolving the same input twice, in any map order, gives identical tables.
     */
    @Test
    @Tag("unit")
    void testResolutionIsIdempotent() throws ParseException {
        // Arrange
        AssemblyFile a = parse(A, "global foo", "extern bar", "foo:", ".x:");
        AssemblyFile b = parse(B, "global bar", "extern foo", "bar:", ".y:");
        Map<Path, AssemblyFile> forward = new LinkedHashMap<>();
        forward.put(A, a);
        forward.put(B, b);
        Map<Path, AssemblyFile> backward = new LinkedHashMap<>();
        backward.put(B, b);
        backward.put(A, a);

        // Act
        AssemblyProject first = AssemblyProject.buildFrom(forward);
        AssemblyProject second = AssemblyProject.buildFrom(backward);

        // Assert
        assertThat(second.getGlobalSources()).isEqualTo(first.getGlobalSources());
        assertThat(second.getInternalExterns()).isEqualTo(first.getInternalExterns());
        assertThat(second.getSymbols()).isEqualTo(first.getSymbols());
        assertThat(second.getSymbolConstituents()).isEqualTo(first.getSymbolConstituents());
        assertThat(first.getFiles().keySet()).containsExactly(A, B);
    }

    /**
     * Verifies that the first file in path order keeps a global declared twice and that the
     * collision is reported as a warning.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProjectResolver", messagePattern = "Global 'dup' is declared in both .*")
    void testDuplicateGlobalFirstDeclarationWins() throws ParseException {
        // Arrange
        Map<Path, AssemblyFile> files = Map.of(
                B, parse(B, "global dup", "dup:"),
                A, parse(A, "global dup", "dup:"));

        // Act
        AssemblyProject project = AssemblyProject.buildFrom(files);

        // Assert
        assertThat(project.getGlobalSources()).containsEntry("dup", A);
        assertThat(project.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.toString()).isEqualTo("[WARNING] b.asm:2: Global 'dup' is already declared in " + A);
            assertThat(warning.source().fileName()).isEqualTo(B.toString());
            assertThat(warning.source().line()).isEqualTo(2);
        });
        assertThat(project.symbolsOf(B).get("dup").visibility()).isEqualTo(Visibility.GLOBAL);
    }

    /**
     * Verifies that a resolver can be reused and that each project carries only the
     * warnings of its own resolution.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Global 'dup' is declared in both .*", occurrences = 2)
    void testReusedResolverKeepsWarningsPerProject() throws ParseException {
        // Arrange
        ProjectResolver resolver = new ProjectResolver();
        Map<Path, AssemblyFile> files = Map.of(
                A, parse(A, "global dup", "dup:"),
                B, parse(B, "global dup", "dup:"));

        // Act
        AssemblyProject first = resolver.resolve(files);
        AssemblyProject second = resolver.resolve(files);

        // Assert
        assertThat(first.getWarnings()).hasSize(1);
        assertThat(second.getWarnings()).isEqualTo(first.getWarnings());
        assertThat(second.getSymbols()).isEqualTo(first.getSymbols());
        assertThat(second.getGlobalSources()).isEqualTo(first.getGlobalSources());
    }

    /**
     * Verifies that a dotted label with no enclosing label is reported and dropped.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Sub-label '.orphan' in .* has no enclosing label")
    void testOrphanSubLabel() throws ParseException {
        // Act
        AssemblyProject project = AssemblyProject.buildFrom(Map.of(A, parse(A, ".orphan:", "main:")));

        // Assert
        assertThat(project.getSymbolConstituents()).isEmpty();
        assertThat(project.symbolsOf(A)).containsOnlyKeys("main");
        assertThat(project.getWarnings()).extracting(Diagnostic::message)
                .containsExactly("Sub-label '.orphan' has no enclosing label");
    }

    /**
     * Verifies that sections are scanned text first, so a sub-label in the text section
     * belongs to the text label even when a data label appears earlier in the file.
     */
    @Test
    @Tag("unit")
    void testSectionScanOrder() throws ParseException {
        // Act
        AssemblyProject project = AssemblyProject.buildFrom(Map.of(A, parse(A,
                "section .data", "table:", "section .text", "main:", ".loop:")));

        // Assert
        assertThat(project.symbolsOf(A).keySet()).containsExactly("main", "table");
        assertThat(project.symbolsOf(A).get("table").section()).isEqualTo(AssemblySection.DATA);
        assertThat(project.constituentsOf("main")).containsExactly(".loop");
        assertThat(project.constituentsOf("table")).isEmpty();
    }

    /**
     * Verifies that a label defined in the same file as its extern declaration replaces the
     * external entry while keeping its position.
     */
    @Test
    @Tag("unit")
    void testLocalDefinitionOverridesExtern() throws ParseException {
        // Act
        AssemblyProject project = AssemblyProject.buildFrom(Map.of(A, parse(A, "extern util", "extern other", "util:")));

        // Assert
        assertThat(project.symbolsOf(A).values()).extracting(Symbol::name, Symbol::visibility)
                .containsExactly(
                        tuple("util", Visibility.PRIVATE),
                        tuple("other", Visibility.EXTERNAL));
    }
}
