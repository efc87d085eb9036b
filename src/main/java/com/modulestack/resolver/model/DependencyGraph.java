package com.modulestack.resolver.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lombok.Getter;

/**
 * All dependency nodes discovered for one build target, keyed by build variable name.
 *
 * Grows monotonically: nodes are added in discovery order and never removed.
 */
public class DependencyGraph {

    @Getter
    private final String rootVariableName;

    private final Map<String, DependencyNode> nodesByVariable = new LinkedHashMap<>();

    public DependencyGraph(String rootVariableName) {
        this.rootVariableName = Objects.requireNonNull(rootVariableName, "rootVariableName");
    }

    /**
     * Add a node unless one is already present for its variable.
     *
     * @return true if the node was added
     */
    public boolean addNode(DependencyNode node) {
        Objects.requireNonNull(node, "node");
        return nodesByVariable.putIfAbsent(node.getVariableName(), node) == null;
    }

    public Optional<DependencyNode> findNode(String variable) {
        return Optional.ofNullable(nodesByVariable.get(variable));
    }

    public boolean contains(String variable) {
        return nodesByVariable.containsKey(variable);
    }

    public DependencyNode getRoot() {
        DependencyNode root = nodesByVariable.get(rootVariableName);
        if (root == null) {
            throw new IllegalStateException("Root node " + rootVariableName + " has not been introspected");
        }
        return root;
    }

    /**
     * Variable names in discovery order (a snapshot).
     */
    public List<String> getVariables() {
        return List.copyOf(nodesByVariable.keySet());
    }

    public Collection<DependencyNode> getNodes() {
        return Collections.unmodifiableCollection(nodesByVariable.values());
    }

    public int size() {
        return nodesByVariable.size();
    }

    /**
     * Unresolved references left on every node, keyed by the owning node's variable.
     */
    public Map<String, Map<String, String>> unresolvedReferences() {
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        for (DependencyNode node : nodesByVariable.values()) {
            if (!node.isFullyResolved()) {
                result.put(node.getVariableName(), Map.copyOf(node.getUnresolvedReferences()));
            }
        }
        return result;
    }
}
