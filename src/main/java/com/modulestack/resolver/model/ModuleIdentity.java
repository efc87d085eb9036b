package com.modulestack.resolver.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifies one dependency's on-disk materialization: the platform release it was
 * built against ({@code base}), the module directory name and the version tag.
 *
 * Derived from a path by {@link com.modulestack.resolver.convention.PathConventionParser},
 * except for the platform itself which is built explicitly.
 */
@Value
@Builder(toBuilder = true)
public class ModuleIdentity {

    @NonNull
    String base;

    @NonNull
    String name;

    @NonNull
    String tag;

    @Override
    public String toString() {
        return name + "@" + tag + " (base " + base + ")";
    }
}
