package com.modulestack.resolver.model.core.context;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.modulestack.resolver.convention.NamingOverrides;
import com.modulestack.resolver.convention.PathConventionParser;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Configuration for one resolution run.
 */
@Value
@Builder(toBuilder = true)
public class ResolverConfig {

    public static final String DEFAULT_PLATFORM_VARIABLE = "EPICS_BASE";
    public static final String DEFAULT_PLATFORM_TAG = "R7.0.2-2.branch";
    public static final String DEFAULT_REPO_OWNER = "slac-epics";
    public static final String DEFAULT_DESCRIPTOR_NAME = "defaults";

    /**
     * The module or application whose dependencies are resolved.
     */
    @NonNull
    Path targetPath;

    /**
     * Root of the cache; modules are materialized under {@code <cacheDir>/modules}.
     */
    @NonNull
    Path cacheDir;

    /**
     * Where version descriptors are written; {@code <cacheDir>/sets} when unset.
     */
    Path descriptorDir;

    @NonNull
    @Builder.Default
    String descriptorName = DEFAULT_DESCRIPTOR_NAME;

    @NonNull
    @Builder.Default
    String platformTag = DEFAULT_PLATFORM_TAG;

    @NonNull
    @Builder.Default
    String platformVariable = DEFAULT_PLATFORM_VARIABLE;

    @NonNull
    @Builder.Default
    String repoOwner = DEFAULT_REPO_OWNER;

    @NonNull
    @Builder.Default
    List<String> rootPrefixes = PathConventionParser.DEFAULT_ROOT_PREFIXES;

    @NonNull
    @Builder.Default
    IntrospectionPaths introspectionPaths = IntrospectionPaths.defaults();

    /**
     * Patched into config files alongside the resolved dependency paths.
     */
    @NonNull
    @Singular
    Map<String, String> extraPatchVariables;

    @NonNull
    @Builder.Default
    NamingOverrides overrides = NamingOverrides.defaults();

    @Builder.Default
    boolean resetConfigure = true;

    public Path getModuleCacheDir() {
        return cacheDir.resolve("modules");
    }

    public Path getEffectiveDescriptorDir() {
        return descriptorDir != null ? descriptorDir : cacheDir.resolve("sets");
    }
}
