package com.modulestack.resolver.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Build order of the registered modules.
 *
 * {@code modules} never contains the platform variable, which is implicitly first.
 * When {@code degraded} is set, the tail of {@code modules} was appended without
 * its requirements being satisfied; {@code unsatisfiedRequirements} lists what each stuck
 * variable was still waiting for.
 */
@Value
@Builder(toBuilder = true)
public class BuildOrder {

    @NonNull
    String platformVariable;

    @NonNull
    @Singular
    List<String> modules;

    boolean degraded;

    @NonNull
    @Singular
    Map<String, Set<String>> unsatisfiedRequirements;

    /**
     * The platform variable followed by {@link #getModules()}.
     */
    public List<String> withPlatform() {
        List<String> all = new ArrayList<>(modules.size() + 1);
        all.add(platformVariable);
        all.addAll(modules);
        return all;
    }
}
