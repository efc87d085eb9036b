package com.modulestack.resolver.spi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import com.modulestack.resolver.model.DependencyGraph;
import com.modulestack.resolver.model.DependencyNode;

/**
 * Reads a module's build configuration and reports what it depends on.
 */
public interface IntrospectionCollaborator {

    /**
     * Find the build-configuration file of the module at {@code path}.
     *
     * @param introspectionVariables site paths predefined while reading configuration
     * @throws IOException if no configuration can be found
     */
    ConfigFileHandle locateConfigFile(Path path, Map<String, String> introspectionVariables) throws IOException;

    /**
     * Build the node for {@code variableName} and add it to {@code rootGraph}, together with
     * nodes for any dependencies it recursively introspects. Returns the graph's node for
     * {@code variableName}, which may be a node added earlier.
     */
    DependencyNode buildDependencyNode(ConfigFileHandle handle,
                                       String variableName,
                                       DependencyGraph rootGraph) throws IOException;
}
