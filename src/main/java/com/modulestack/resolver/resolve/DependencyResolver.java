package com.modulestack.resolver.resolve;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.convention.ModulePathLayout;
import com.modulestack.resolver.convention.PathConventionParser;
import com.modulestack.resolver.model.DependencyGraph;
import com.modulestack.resolver.model.DependencyNode;
import com.modulestack.resolver.model.ModuleIdentity;
import com.modulestack.resolver.model.core.context.ToolDiagnostics;
import com.modulestack.resolver.registry.DependencyRegistry;
import com.modulestack.resolver.registry.RegistrationConflictException;

/**
 * Discovers missing dependencies across a growing dependency graph and points every
 * recognized reference at its materialized module.
 *
 * Nodes are processed from a worklist. Nodes that appear in the graph while a
 * reference is being registered are queued behind the current ones, so every node is
 * visited exactly once and the loop ends once no new recognized module turns up.
 */
public class DependencyResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final PathConventionParser parser;
    private final ModulePathLayout layout;
    private final DependencyRegistrar registrar;

    public DependencyResolver(PathConventionParser parser, ModulePathLayout layout, DependencyRegistrar registrar) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.registrar = Objects.requireNonNull(registrar, "registrar");
    }

    public DependencyGraph resolve(DependencyGraph graph, DependencyRegistry registry) throws IOException {
        return resolve(graph, registry, new ToolDiagnostics());
    }

    public DependencyGraph resolve(DependencyGraph graph,
                                   DependencyRegistry registry,
                                   ToolDiagnostics diagnostics) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(diagnostics, "diagnostics");

        Set<String> visited = new HashSet<>();
        Set<String> queued = new HashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        enqueueNewNodes(graph, queued, worklist);

        while (!worklist.isEmpty()) {
            String variable = worklist.poll();
            DependencyNode node = graph.findNode(variable)
                    .orElseThrow(() -> new IllegalStateException("Queued node vanished from graph: " + variable));
            visited.add(variable);

            log.debug("Checking module {} for all dependencies. Existing: {} Missing: {}",
                    describe(graph, node),
                    format(node.getResolvedDependencies()),
                    format(node.getUnresolvedReferences()));

            // Copy: resolving an entry removes it from the node's unresolved map.
            Map<String, String> references = new LinkedHashMap<>(node.getUnresolvedReferences());
            for (Map.Entry<String, String> reference : references.entrySet()) {
                resolveReference(graph, registry, diagnostics, node, reference.getKey(), reference.getValue(), visited);
                enqueueNewNodes(graph, queued, worklist);
            }
        }

        log.debug("Resolution finished: {} nodes, {} registered dependencies", graph.size(), registry.size());
        return graph;
    }

    private void resolveReference(DependencyGraph graph,
                                  DependencyRegistry registry,
                                  ToolDiagnostics diagnostics,
                                  DependencyNode node,
                                  String variable,
                                  String rawPath,
                                  Set<String> visited) throws IOException {
        if (visited.contains(variable)) {
            Optional<ModuleIdentity> identity = registry.identity(variable);
            if (identity.isPresent()) {
                node.markResolved(variable, layout.pathFor(identity.get()));
            } else {
                log.warn("Dependency still missing: {} (referenced by {})", variable, describe(graph, node));
                diagnostics.getWarnings().add("Dependency still missing: " + variable
                        + " referenced by " + describe(graph, node) + " as " + rawPath);
            }
            return;
        }

        Optional<ModuleIdentity> parsed = parser.parse(rawPath);
        if (parsed.isEmpty()) {
            log.debug("Dependency path for {}={} does not match known patterns", variable, rawPath);
            return;
        }

        try {
            registrar.register(variable, parsed.get());
        } catch (RegistrationConflictException e) {
            log.warn("Conflicting version for {} requested by {}: {}", variable, describe(graph, node), e.getMessage());
            diagnostics.getWarnings().add(e.getMessage() + " (requested by " + describe(graph, node) + ")");
        }

        ModuleIdentity registered = registry.identity(variable).orElse(parsed.get());
        Path path = layout.pathFor(registered);
        node.markResolved(variable, path);
        log.info("Set dependency of {}: {}={}", describe(graph, node), variable, path);
    }

    private static void enqueueNewNodes(DependencyGraph graph, Set<String> queued, Deque<String> worklist) {
        for (String variable : graph.getVariables()) {
            if (queued.add(variable)) {
                worklist.add(variable);
            }
        }
    }

    private static String describe(DependencyGraph graph, DependencyNode node) {
        return node.getVariableName().equals(graph.getRootVariableName())
                ? "the build target"
                : node.getVariableName();
    }

    private static String format(Map<String, ?> entries) {
        if (entries.isEmpty()) {
            return "none";
        }
        return entries.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
