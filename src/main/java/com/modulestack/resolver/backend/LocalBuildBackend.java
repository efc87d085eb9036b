package com.modulestack.resolver.backend;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.spi.BuildBackend;
import com.modulestack.resolver.spi.SettingsStore;
import com.modulestack.resolver.util.FileWriteUtil;

/**
 * Build backend that keeps its state in memory and on the local filesystem.
 *
 * The local release record is a {@code NAME=path} file rewritten on every update.
 * Checkout resets run {@code git checkout -- <dir>} and are skipped for directories
 * that are not git working trees.
 */
public class LocalBuildBackend implements BuildBackend {
    private static final Logger log = LoggerFactory.getLogger(LocalBuildBackend.class);

    private final Path releaseLocalFile;
    private final MapSettingsStore settings = new MapSettingsStore();
    private final Set<String> registered = new LinkedHashSet<>();
    private final Map<String, String> releaseRecords = new LinkedHashMap<>();
    private final List<String> modulesToCompile = new ArrayList<>();

    public LocalBuildBackend(Path releaseLocalFile) {
        this.releaseLocalFile = Objects.requireNonNull(releaseLocalFile, "releaseLocalFile");
    }

    @Override
    public void registerDependency(String variableName) {
        if (registered.add(variableName)) {
            log.debug("Registered dependency {}", variableName);
        }
    }

    @Override
    public void updateLocalReleaseRecord(String variableName, Path path) throws IOException {
        releaseRecords.put(variableName, path.toString());
        StringBuilder content = new StringBuilder();
        for (Map.Entry<String, String> entry : releaseRecords.entrySet()) {
            content.append(entry.getKey()).append('=').append(entry.getValue()).append('\n');
        }
        FileWriteUtil.safeWriteString(releaseLocalFile, content.toString());
    }

    @Override
    public void runCheckoutReset(Path path, String subdirectory) throws IOException {
        if (!Files.exists(path.resolve(".git"))) {
            log.debug("Not a git checkout, nothing to reset: {}", path);
            return;
        }

        ProcessBuilder pb = new ProcessBuilder("git", "checkout", "--", subdirectory)
                .directory(path.toFile())
                .redirectErrorStream(true);
        Process process = pb.start();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("git: {}", line);
            }
        }

        try {
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IOException("git checkout -- " + subdirectory + " failed in " + path
                        + " with exit code " + exitCode);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while resetting " + subdirectory + " in " + path, e);
        }
    }

    @Override
    public void setModulesToCompile(List<String> modules) {
        modulesToCompile.clear();
        modulesToCompile.addAll(modules);
    }

    @Override
    public SettingsStore settings() {
        return settings;
    }

    public Set<String> getRegistered() {
        return Collections.unmodifiableSet(registered);
    }

    public Map<String, String> getReleaseRecords() {
        return Collections.unmodifiableMap(releaseRecords);
    }

    public List<String> getModulesToCompile() {
        return Collections.unmodifiableList(modulesToCompile);
    }

    public Path getReleaseLocalFile() {
        return releaseLocalFile;
    }
}
