package com.modulestack.resolver.convention;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Lookup tables for modules that do not follow the naming convention.
 *
 * Every lookup returns the override when one exists and the convention-derived
 * value otherwise.
 */
@Value
@Builder(toBuilder = true)
public class NamingOverrides {

    /**
     * Module directory name to repository name.
     */
    @NonNull
    @Singular
    Map<String, String> repoNames;

    /**
     * Default repository owner to the owner actually used.
     */
    @NonNull
    @Singular
    Map<String, String> repoOwners;

    /**
     * Build variable name to the prefix used in release settings and version descriptors.
     */
    @NonNull
    @Singular
    Map<String, String> descriptorPrefixes;

    public static NamingOverrides defaults() {
        return NamingOverrides.builder()
                .repoName("base", "epics-base")
                .descriptorPrefix("EPICS_BASE", "BASE")
                .build();
    }

    public static NamingOverrides none() {
        return NamingOverrides.builder().build();
    }

    public String repoNameFor(String moduleName) {
        return repoNames.getOrDefault(moduleName, moduleName);
    }

    public String repoOwnerFor(String owner) {
        return repoOwners.getOrDefault(owner, owner);
    }

    public String descriptorPrefixFor(String variable) {
        return descriptorPrefixes.getOrDefault(variable, variable);
    }
}
