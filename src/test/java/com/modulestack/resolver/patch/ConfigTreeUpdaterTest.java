package com.modulestack.resolver.patch;

import com.modulestack.resolver.model.core.context.ToolDiagnostics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConfigTreeUpdater.
 */
class ConfigTreeUpdaterTest {

    @TempDir
    Path tempDir;

    private final ConfigTreeUpdater updater = new ConfigTreeUpdater(new ConfigPatcher());

    @Test
    void testPatchesFilesInsideModuleOnly() throws IOException {
        Path module = Files.createDirectories(tempDir.resolve("module/configure"));
        Files.writeString(module.resolve("RELEASE"), "ASYN=/old/asyn\n");
        Files.writeString(module.resolve("RELEASE.local"), "# nothing\n");
        Path outside = Files.createDirectories(tempDir.resolve("shared/configure"));
        Files.writeString(outside.resolve("RELEASE"), "ASYN=/old/asyn\n");
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        Map<Path, Set<String>> patched = updater.update(tempDir.resolve("module"),
                List.of("configure/RELEASE", "configure/RELEASE.local", "../shared/configure/RELEASE"),
                Map.of("ASYN", "/cache/asyn-R4.39"),
                diagnostics);

        assertThat(patched).containsOnlyKeys(module.resolve("RELEASE").toAbsolutePath().normalize());
        assertThat(Files.readString(module.resolve("RELEASE"))).isEqualTo("ASYN=/cache/asyn-R4.39\n");
        assertThat(Files.readString(outside.resolve("RELEASE"))).isEqualTo("ASYN=/old/asyn\n");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testFailureOnOneFileDoesNotStopTheRest() throws IOException {
        Path module = Files.createDirectories(tempDir.resolve("module/configure"));
        Files.writeString(module.resolve("RELEASE"), "ASYN=/old/asyn\n");
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        Map<Path, Set<String>> patched = updater.update(tempDir.resolve("module"),
                List.of("configure/RELEASE.missing", "configure/RELEASE"),
                Map.of("ASYN", "/cache/asyn-R4.39"),
                diagnostics);

        assertThat(patched).hasSize(1);
        assertThat(Files.readString(module.resolve("RELEASE"))).isEqualTo("ASYN=/cache/asyn-R4.39\n");
        assertThat(diagnostics.getErrors()).singleElement().asString().contains("RELEASE.missing");
    }

    @Test
    void testSymlinkToSharedFileIsSkipped() throws IOException {
        Path module = Files.createDirectories(tempDir.resolve("module/configure"));
        Files.writeString(module.resolve("RELEASE"), "ASYN=/old/asyn\n");
        Path site = Files.createDirectories(tempDir.resolve("site"));
        Path shared = Files.writeString(site.resolve("RELEASE_SITE"), "ASYN=/old/asyn\n");
        Files.createSymbolicLink(module.resolve("RELEASE_SITE"), shared);
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        Map<Path, Set<String>> patched = updater.update(tempDir.resolve("module"),
                List.of("configure/RELEASE", "configure/RELEASE_SITE"),
                Map.of("ASYN", "/cache/asyn-R4.39"),
                diagnostics);

        assertThat(patched).containsOnlyKeys(module.resolve("RELEASE").toAbsolutePath().normalize());
        assertThat(Files.readString(shared)).isEqualTo("ASYN=/old/asyn\n");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testPermissionDeniedIsRecordedAndRestArePatched() throws IOException {
        Path module = Files.createDirectories(tempDir.resolve("module/configure"));
        Path locked = Files.writeString(module.resolve("RELEASE.local"), "ASYN=/old/asyn\n");
        Path release = Files.writeString(module.resolve("RELEASE"), "ASYN=/old/asyn\n");
        ConfigPatcher lockedOut = new ConfigPatcher() {
            @Override
            public Set<String> patch(Path file, Map<String, String> variableToValue) throws IOException {
                if (file.endsWith("RELEASE.local")) {
                    throw new AccessDeniedException(file.toString());
                }
                return super.patch(file, variableToValue);
            }
        };
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        Map<Path, Set<String>> patched = new ConfigTreeUpdater(lockedOut).update(tempDir.resolve("module"),
                List.of("configure/RELEASE.local", "configure/RELEASE"),
                Map.of("ASYN", "/cache/asyn-R4.39"),
                diagnostics);

        assertThat(patched).containsOnlyKeys(release.toAbsolutePath().normalize());
        assertThat(Files.readString(release)).isEqualTo("ASYN=/cache/asyn-R4.39\n");
        assertThat(Files.readString(locked)).isEqualTo("ASYN=/old/asyn\n");
        assertThat(diagnostics.getErrors()).singleElement().asString()
                .startsWith("Permission denied")
                .contains("RELEASE.local");
    }
}
