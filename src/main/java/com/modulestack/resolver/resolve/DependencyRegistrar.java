package com.modulestack.resolver.resolve;

import java.io.IOException;

import com.modulestack.resolver.model.ModuleIdentity;

/**
 * Registers a newly discovered dependency.
 *
 * Implementations record the identity in the registry being resolved and add the
 * materialized module's node (and anything it pulls in) to the graph being resolved.
 * Registering an identity that is already registered must be a no-op.
 */
@FunctionalInterface
public interface DependencyRegistrar {

    void register(String variable, ModuleIdentity identity) throws IOException;
}
