package com.modulestack.resolver.patch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConfigPatcher.
 */
class ConfigPatcherTest {

    private static final FileTime LONG_AGO = FileTime.fromMillis(946_684_800_000L);

    @TempDir
    Path tempDir;

    private final ConfigPatcher patcher = new ConfigPatcher();

    @Test
    void testRewritesAssignmentAndKeepsCommentsAndIndentedLines() throws IOException {
        Path file = write("""
                # Paths to dependencies
                FOO=/old/path
                #FOO=/old/path
                    FOO=/old/path

                BAR = /keep/me
                """);

        Set<String> updated = patcher.patch(file, Map.of("FOO", "/new/path"));

        assertThat(updated).containsExactly("FOO");
        assertThat(Files.readString(file)).isEqualTo("""
                # Paths to dependencies
                FOO=/new/path
                #FOO=/old/path
                    FOO=/old/path

                BAR = /keep/me
                """);
    }

    @Test
    void testPreservesConditionalAndImmediateOperators() throws IOException {
        Path file = write("""
                ASYN ?= /old/asyn
                CALC := /old/calc
                SSCAN = /old/sscan
                """);

        Set<String> updated = patcher.patch(file, Map.of(
                "ASYN", "/cache/asyn-R4.39",
                "CALC", "/cache/calc-R3.7",
                "SSCAN", "/cache/sscan-R2.11"));

        assertThat(updated).containsExactlyInAnyOrder("ASYN", "CALC", "SSCAN");
        assertThat(Files.readString(file)).isEqualTo("""
                ASYN?=/cache/asyn-R4.39
                CALC:=/cache/calc-R3.7
                SSCAN=/cache/sscan-R2.11
                """);
    }

    @Test
    void testUnmatchedFileIsLeftUntouched() throws IOException {
        String content = "# nothing to see\nOTHER=/x   \n\tFOO=/indented\n";
        Path file = write(content);
        Files.setLastModifiedTime(file, LONG_AGO);
        byte[] before = Files.readAllBytes(file);

        Set<String> updated = patcher.patch(file, Map.of("FOO", "/new/path"));

        assertThat(updated).isEmpty();
        assertThat(Files.readAllBytes(file)).isEqualTo(before);
        assertThat(Files.getLastModifiedTime(file)).isEqualTo(LONG_AGO);
    }

    @Test
    void testWindowsLineEndingsArePreserved() throws IOException {
        Path file = write("FOO=/old\r\nBAR=/bar\r\n");

        patcher.patch(file, Map.of("FOO", "/new"));

        assertThat(Files.readString(file)).isEqualTo("FOO=/new\r\nBAR=/bar\r\n");
    }

    @Test
    void testMissingFinalNewlineIsPreserved() throws IOException {
        Path file = write("BAR=/bar\nFOO=/old");

        patcher.patch(file, Map.of("FOO", "/new"));

        assertThat(Files.readString(file)).isEqualTo("BAR=/bar\nFOO=/new");
    }

    @Test
    void testNonUtf8BytesSurviveRewrite() throws IOException {
        Path file = tempDir.resolve("RELEASE");
        byte[] latin1 = "# café\nFOO=/old\n".getBytes(StandardCharsets.ISO_8859_1);
        Files.write(file, latin1);

        patcher.patch(file, Map.of("FOO", "/new"));

        assertThat(Files.readAllBytes(file))
                .isEqualTo("# café\nFOO=/new\n".getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void testPatchLineDropsTrailingWhitespaceAndComment() {
        Set<String> updated = new LinkedHashSet<>();

        String line = patcher.patchLine("FOO = /old/path   # trailing", Map.of("FOO", "/new"), updated);

        assertThat(line).isEqualTo("FOO=/new");
        assertThat(updated).containsExactly("FOO");
    }

    @Test
    void testPatchLineUsesFirstOperatorInPriorityOrder() {
        Set<String> updated = new LinkedHashSet<>();

        assertThat(patcher.patchLine("FOO?=a=b", Map.of("FOO", "/x"), updated)).isEqualTo("FOO?=/x");
        assertThat(patcher.patchLine("FOO:=a?b", Map.of("FOO", "/x"), updated)).isEqualTo("FOO:=/x");
    }

    @Test
    void testPatchLineFallsBackToLaterOperator() {
        Set<String> updated = new LinkedHashSet<>();

        assertThat(patcher.patchLine("FOO = a:=b", Map.of("FOO", "/new"), updated)).isEqualTo("FOO=/new");
        assertThat(patcher.patchLine("FOO := a?=b", Map.of("FOO", "/new"), updated)).isEqualTo("FOO:=/new");
        assertThat(updated).containsExactly("FOO");
    }

    @Test
    void testPatchLineLeavesOtherVariablesAlone() {
        Set<String> updated = new LinkedHashSet<>();

        assertThat(patcher.patchLine("FOOBAR=/old", Map.of("FOO", "/x"), updated)).isEqualTo("FOOBAR=/old");
        assertThat(patcher.patchLine("include $(TOP)/configure/RELEASE.local", Map.of("FOO", "/x"), updated))
                .isEqualTo("include $(TOP)/configure/RELEASE.local");
        assertThat(updated).isEmpty();
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("RELEASE");
        Files.writeString(file, content);
        return file;
    }
}
