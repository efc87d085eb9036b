package com.modulestack.resolver.spi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The build-execution side: tracks which modules to fetch and compile, and keeps
 * the local release record pointing at materialized module directories.
 */
public interface BuildBackend {

    void registerDependency(String variableName);

    void updateLocalReleaseRecord(String variableName, Path path) throws IOException;

    /**
     * Discard local modifications to {@code subdirectory} of the checkout at {@code path}.
     */
    void runCheckoutReset(Path path, String subdirectory) throws IOException;

    void setModulesToCompile(List<String> modules);

    SettingsStore settings();
}
