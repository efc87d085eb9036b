package com.modulestack.resolver.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.modulestack.resolver.model.DependencyNode;
import com.modulestack.resolver.model.ModuleIdentity;

/**
 * Module identities and dependency nodes by build variable name, for one resolution run.
 *
 * A variable keeps the first identity it was registered with. Registering the same
 * identity again is a no-op; registering a different one is rejected.
 */
public class DependencyRegistry {

    private final Map<String, ModuleIdentity> identityByVariable = new LinkedHashMap<>();
    private final Map<String, DependencyNode> nodeByVariable = new LinkedHashMap<>();

    /**
     * @return true if the variable was newly registered, false if it already had this identity
     * @throws RegistrationConflictException if the variable is registered with another identity
     */
    public boolean register(String variable, ModuleIdentity identity) {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(identity, "identity");

        ModuleIdentity existing = identityByVariable.get(variable);
        if (existing == null) {
            identityByVariable.put(variable, identity);
            return true;
        }
        if (existing.equals(identity)) {
            return false;
        }
        throw new RegistrationConflictException(variable, existing, identity);
    }

    /**
     * Attach the introspected node of a registered variable.
     */
    public void attachNode(String variable, DependencyNode node) {
        Objects.requireNonNull(node, "node");
        if (!identityByVariable.containsKey(variable)) {
            throw new IllegalStateException("Cannot attach a node to unregistered dependency " + variable);
        }
        DependencyNode existing = nodeByVariable.putIfAbsent(variable, node);
        if (existing != null && existing != node) {
            throw new IllegalStateException("Dependency " + variable + " already has a node attached");
        }
    }

    public Optional<ModuleIdentity> identity(String variable) {
        return Optional.ofNullable(identityByVariable.get(variable));
    }

    public Optional<DependencyNode> node(String variable) {
        return Optional.ofNullable(nodeByVariable.get(variable));
    }

    public boolean isRegistered(String variable) {
        return identityByVariable.containsKey(variable);
    }

    /**
     * Registered variables in registration order.
     */
    public Set<String> getVariables() {
        return Collections.unmodifiableSet(identityByVariable.keySet());
    }

    public Map<String, ModuleIdentity> getIdentities() {
        return Collections.unmodifiableMap(identityByVariable);
    }

    public Map<String, DependencyNode> getNodes() {
        return Collections.unmodifiableMap(nodeByVariable);
    }

    public int size() {
        return identityByVariable.size();
    }
}
