package com.modulestack.resolver.support;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modulestack.resolver.backend.MapSettingsStore;
import com.modulestack.resolver.spi.BuildBackend;

/**
 * In-memory build backend that records every call.
 */
public class RecordingBuildBackend implements BuildBackend {

    private final MapSettingsStore settings = new MapSettingsStore();
    private final List<String> registered = new ArrayList<>();
    private final Map<String, Path> releaseRecords = new LinkedHashMap<>();
    private final List<Path> checkoutResets = new ArrayList<>();
    private final List<String> modulesToCompile = new ArrayList<>();

    @Override
    public void registerDependency(String variableName) {
        registered.add(variableName);
    }

    @Override
    public void updateLocalReleaseRecord(String variableName, Path path) {
        releaseRecords.put(variableName, path);
    }

    @Override
    public void runCheckoutReset(Path path, String subdirectory) {
        checkoutResets.add(path.resolve(subdirectory));
    }

    @Override
    public void setModulesToCompile(List<String> modules) {
        modulesToCompile.clear();
        modulesToCompile.addAll(modules);
    }

    @Override
    public MapSettingsStore settings() {
        return settings;
    }

    public List<String> getRegistered() {
        return registered;
    }

    public Map<String, Path> getReleaseRecords() {
        return releaseRecords;
    }

    public List<Path> getCheckoutResets() {
        return checkoutResets;
    }

    public List<String> getModulesToCompile() {
        return modulesToCompile;
    }
}
