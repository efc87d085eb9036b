package com.modulestack.resolver.order;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.model.BuildOrder;
import com.modulestack.resolver.model.DependencyNode;
import com.modulestack.resolver.registry.DependencyRegistry;

/**
 * Orders registered modules so that each one comes after everything it depends on.
 *
 * Candidates are scanned in lexicographic order, so the output is reproducible.
 * When a full scan places nothing, the remaining variables are appended in
 * lexicographic order and the result is flagged as degraded.
 */
public class BuildOrderSolver {
    private static final Logger log = LoggerFactory.getLogger(BuildOrderSolver.class);

    private final String platformVariable;

    public BuildOrderSolver(String platformVariable) {
        this.platformVariable = Objects.requireNonNull(platformVariable, "platformVariable");
    }

    public BuildOrder solve(DependencyRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        if (!registry.isRegistered(platformVariable)) {
            throw new IllegalStateException("Platform dependency " + platformVariable + " is not registered");
        }

        List<String> placed = new ArrayList<>();
        placed.add(platformVariable);
        Set<String> placedSet = new HashSet<>(placed);

        TreeSet<String> remaining = new TreeSet<>(registry.getVariables());
        remaining.removeAll(placedSet);

        Map<String, Set<String>> requirements = new TreeMap<>();
        for (String variable : remaining) {
            requirements.put(variable, requirementsOf(registry, variable));
        }
        log.debug("Trying to determine build order based on these requirements: {}", requirements);

        BuildOrder.BuildOrderBuilder result = BuildOrder.builder().platformVariable(platformVariable);

        while (!remaining.isEmpty()) {
            boolean progressed = false;
            for (String candidate : new ArrayList<>(remaining)) {
                if (placedSet.containsAll(requirements.get(candidate))) {
                    placed.add(candidate);
                    placedSet.add(candidate);
                    remaining.remove(candidate);
                    progressed = true;
                }
            }
            if (!progressed) {
                Map<String, Set<String>> outstanding = new TreeMap<>();
                for (String stuck : remaining) {
                    Set<String> missing = new TreeSet<>(requirements.get(stuck));
                    missing.removeAll(placedSet);
                    outstanding.put(stuck, missing);
                }
                log.warn("Unable to determine build order. Determined build order: {}. Remaining: {} which require: {}",
                        placed, remaining, outstanding);
                placed.addAll(remaining);
                remaining.clear();
                result.degraded(true).unsatisfiedRequirements(outstanding);
            }
        }

        log.debug("Determined build order: {}", String.join(", ", placed));
        return result.modules(placed.subList(1, placed.size())).build();
    }

    /**
     * Everything {@code variable} depends on, excluding itself. A registered variable
     * without an introspected node has no requirements.
     */
    private static Set<String> requirementsOf(DependencyRegistry registry, String variable) {
        return registry.node(variable)
                .map(DependencyNode::requiredVariables)
                .orElseGet(LinkedHashSet::new);
    }
}
