package com.modulestack.resolver.backend;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.spi.BuildBackend;
import com.modulestack.resolver.spi.ScopedOverride;
import com.modulestack.resolver.spi.SettingsStore;

/**
 * A {@link BuildBackend} that forwards to a replaceable delegate.
 *
 * {@link #override(BuildBackend)} swaps in a substitute until the returned handle is
 * closed, which is how individual side effects are suppressed for a bounded scope.
 */
public class BackendSlot implements BuildBackend {
    private static final Logger log = LoggerFactory.getLogger(BackendSlot.class);

    private BuildBackend current;

    public BackendSlot(BuildBackend initial) {
        this.current = Objects.requireNonNull(initial, "initial");
    }

    public BuildBackend current() {
        return current;
    }

    public ScopedOverride override(BuildBackend substitute) {
        Objects.requireNonNull(substitute, "substitute");
        BuildBackend original = current;
        current = substitute;
        return ScopedOverride.of(() -> current = original);
    }

    /**
     * Same as {@code delegate}, except that checkout resets are skipped.
     */
    public static BuildBackend withoutCheckoutReset(BuildBackend delegate) {
        Objects.requireNonNull(delegate, "delegate");
        return new BuildBackend() {
            @Override
            public void registerDependency(String variableName) {
                delegate.registerDependency(variableName);
            }

            @Override
            public void updateLocalReleaseRecord(String variableName, Path path) throws IOException {
                delegate.updateLocalReleaseRecord(variableName, path);
            }

            @Override
            public void runCheckoutReset(Path path, String subdirectory) {
                log.debug("Checkout reset suppressed: {} in {}", subdirectory, path);
            }

            @Override
            public void setModulesToCompile(List<String> modules) {
                delegate.setModulesToCompile(modules);
            }

            @Override
            public SettingsStore settings() {
                return delegate.settings();
            }
        };
    }

    @Override
    public void registerDependency(String variableName) {
        current.registerDependency(variableName);
    }

    @Override
    public void updateLocalReleaseRecord(String variableName, Path path) throws IOException {
        current.updateLocalReleaseRecord(variableName, path);
    }

    @Override
    public void runCheckoutReset(Path path, String subdirectory) throws IOException {
        current.runCheckoutReset(path, subdirectory);
    }

    @Override
    public void setModulesToCompile(List<String> modules) {
        current.setModulesToCompile(modules);
    }

    @Override
    public SettingsStore settings() {
        return current.settings();
    }
}
