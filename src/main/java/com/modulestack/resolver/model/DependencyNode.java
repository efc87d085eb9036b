package com.modulestack.resolver.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lombok.Getter;
import lombok.ToString;

/**
 * Dependency information for one module, as produced by the introspection collaborator.
 *
 * Only the resolver moves entries from {@link #getUnresolvedReferences()} into
 * {@link #getResolvedDependencies()}; an entry is never present in both maps.
 */
@Getter
@ToString
public class DependencyNode {

    private final String variableName;
    private final Map<String, Path> resolvedDependencies;
    private final Map<String, String> unresolvedReferences;
    private final List<String> configFileRefs;

    public DependencyNode(String variableName,
                          Map<String, Path> resolvedDependencies,
                          Map<String, String> unresolvedReferences,
                          List<String> configFileRefs) {
        this.variableName = Objects.requireNonNull(variableName, "variableName");
        this.resolvedDependencies = new LinkedHashMap<>(
                resolvedDependencies != null ? resolvedDependencies : Map.of());
        this.unresolvedReferences = new LinkedHashMap<>(
                unresolvedReferences != null ? unresolvedReferences : Map.of());
        this.configFileRefs = new ArrayList<>(configFileRefs != null ? configFileRefs : List.of());
        this.unresolvedReferences.keySet().removeAll(this.resolvedDependencies.keySet());
    }

    public Map<String, Path> getResolvedDependencies() {
        return Collections.unmodifiableMap(resolvedDependencies);
    }

    public Map<String, String> getUnresolvedReferences() {
        return Collections.unmodifiableMap(unresolvedReferences);
    }

    public List<String> getConfigFileRefs() {
        return Collections.unmodifiableList(configFileRefs);
    }

    /**
     * Move a reference to the resolved side, pointing at {@code path}.
     */
    public void markResolved(String variable, Path path) {
        unresolvedReferences.remove(variable);
        resolvedDependencies.put(variable, path);
    }

    /**
     * Names of the resolved dependencies, without a self-reference.
     */
    public Set<String> requiredVariables() {
        Set<String> required = new LinkedHashSet<>(resolvedDependencies.keySet());
        required.remove(variableName);
        return required;
    }

    public boolean isFullyResolved() {
        return unresolvedReferences.isEmpty();
    }
}
