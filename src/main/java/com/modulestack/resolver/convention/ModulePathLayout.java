package com.modulestack.resolver.convention;

import java.nio.file.Path;
import java.util.Objects;

import com.modulestack.resolver.model.ModuleIdentity;

/**
 * Where materialized modules live inside the module cache.
 */
public class ModulePathLayout {

    public static final String BRANCH_MARKER = "-branch";
    public static final String RELEASE_LOCAL = "RELEASE.local";

    private final Path moduleCacheDir;

    public ModulePathLayout(Path moduleCacheDir) {
        this.moduleCacheDir = Objects.requireNonNull(moduleCacheDir, "moduleCacheDir");
    }

    public Path getModuleCacheDir() {
        return moduleCacheDir;
    }

    /**
     * {@code <moduleCache>/<name>-<tag>}, with a {@code -branch} marker dropped from the tag.
     */
    public Path pathFor(ModuleIdentity identity) {
        String tag = identity.getTag().replace(BRANCH_MARKER, "");
        return moduleCacheDir.resolve(identity.getName() + "-" + tag);
    }

    public Path releaseLocalFile() {
        return moduleCacheDir.resolve(RELEASE_LOCAL);
    }
}
