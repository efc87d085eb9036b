package com.modulestack.resolver.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.backend.BackendSlot;
import com.modulestack.resolver.backend.SettingsUpdater;
import com.modulestack.resolver.convention.ModulePathLayout;
import com.modulestack.resolver.convention.NamingOverrides;
import com.modulestack.resolver.convention.PathConventionParser;
import com.modulestack.resolver.descriptor.DescriptorLine;
import com.modulestack.resolver.descriptor.ReleaseSettingsExpander;
import com.modulestack.resolver.descriptor.VersionDescriptorWriter;
import com.modulestack.resolver.model.BuildOrder;
import com.modulestack.resolver.model.DependencyGraph;
import com.modulestack.resolver.model.DependencyNode;
import com.modulestack.resolver.model.ModuleIdentity;
import com.modulestack.resolver.model.core.context.IntrospectionPaths;
import com.modulestack.resolver.model.core.context.ResolverConfig;
import com.modulestack.resolver.model.core.context.ToolDiagnostics;
import com.modulestack.resolver.order.BuildOrderSolver;
import com.modulestack.resolver.patch.ConfigPatcher;
import com.modulestack.resolver.patch.ConfigTreeUpdater;
import com.modulestack.resolver.registry.DependencyRegistry;
import com.modulestack.resolver.resolve.DependencyRegistrar;
import com.modulestack.resolver.resolve.DependencyResolver;
import com.modulestack.resolver.spi.BuildBackend;
import com.modulestack.resolver.spi.ConfigFileHandle;
import com.modulestack.resolver.spi.IntrospectionCollaborator;
import com.modulestack.resolver.spi.ScopedOverride;

/**
 * One resolution run for a build target.
 *
 * Owns the dependency graph and registry of the run, registers dependencies with the
 * build backend, and drives discovery, ordering, descriptor generation and config
 * file patching. Not safe for concurrent use; two sessions must not share a cache
 * directory at the same time.
 */
public class ModuleStackSession implements DependencyRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ModuleStackSession.class);

    public static final String PLATFORM_MODULE_NAME = "epics-base";
    public static final String TARGET_VARIABLE = "TOP";
    public static final String CONFIGURE_DIR = "configure";

    private final ResolverConfig config;
    private final IntrospectionCollaborator introspection;
    private final BackendSlot backend;
    private final ModulePathLayout layout;
    private final PathConventionParser parser;
    private final NamingOverrides overrides;
    private final ReleaseSettingsExpander expander;
    private final ConfigTreeUpdater treeUpdater;
    private final VersionDescriptorWriter descriptorWriter;
    private final BuildOrderSolver solver;

    private final DependencyRegistry registry = new DependencyRegistry();
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    private IntrospectionPaths introspectionPaths;
    private DependencyGraph graph;

    public ModuleStackSession(ResolverConfig config, IntrospectionCollaborator introspection, BuildBackend backend) {
        this.config = Objects.requireNonNull(config, "config");
        this.introspection = Objects.requireNonNull(introspection, "introspection");
        this.backend = new BackendSlot(Objects.requireNonNull(backend, "backend"));
        this.layout = new ModulePathLayout(config.getModuleCacheDir());
        this.parser = new PathConventionParser(config.getRootPrefixes());
        this.overrides = config.getOverrides();
        this.expander = new ReleaseSettingsExpander(overrides, this.backend.settings(), config.getRepoOwner());
        this.treeUpdater = new ConfigTreeUpdater(new ConfigPatcher());
        this.descriptorWriter = new VersionDescriptorWriter();
        this.solver = new BuildOrderSolver(config.getPlatformVariable());
        this.introspectionPaths = config.getIntrospectionPaths();

        this.backend.settings().set(ReleaseSettingsExpander.REPO_OWNER_SETTING, config.getRepoOwner());
    }

    /**
     * Run the whole preparation: platform, discovery, descriptor, config files, build order.
     * Failures are reported in the summary rather than thrown.
     */
    public ResolutionSummary prepare() {
        try (ScopedOverride resets = config.isResetConfigure() ? null : suppressCheckoutResets()) {
            log.info("Step 1: Preparing platform {}...", config.getPlatformTag());
            usePlatform(config.getPlatformTag());

            log.info("Step 2: Finding all dependencies...");
            findAllDependencies();

            BuildOrder order = buildOrder();

            log.info("Step 3: Writing version descriptor...");
            Path descriptor = writeVersionDescriptor(config.getDescriptorName(), order);

            log.info("Step 4: Updating config files...");
            Map<Path, Set<String>> patched = updateConfigFiles();

            log.info("Step 5: Updating the build order...");
            updateBuildOrder(order);

            return ResolutionSummary.builder()
                    .success(true)
                    .registeredModules(new LinkedHashMap<>(registry.getIdentities()))
                    .buildOrder(order)
                    .descriptorFile(descriptor)
                    .patchedFiles(patched)
                    .unresolvedReferences(graph.unresolvedReferences())
                    .diagnostics(diagnostics)
                    .build();
        } catch (IOException | RuntimeException e) {
            log.error("Preparation failed", e);
            ResolutionSummary failure = ResolutionSummary.failure(e.getMessage() != null ? e.getMessage() : e.toString());
            failure.setDiagnostics(diagnostics);
            return failure;
        }
    }

    /**
     * Register the platform at {@code tag} and introspect the build target against it.
     */
    public void usePlatform(String tag) throws IOException {
        ModuleIdentity platform = ModuleIdentity.builder()
                .name(PLATFORM_MODULE_NAME)
                .base(tag)
                .tag(tag)
                .build();
        addDependency(config.getPlatformVariable(), platform, false);

        Path platformPath = layout.pathFor(platform);
        introspectionPaths = introspectionPaths.withPlatformBase(platformPath);

        // Earlier patching must not leak into introspection of the target.
        backend.runCheckoutReset(config.getTargetPath(), CONFIGURE_DIR);

        ConfigFileHandle handle = introspection.locateConfigFile(config.getTargetPath(),
                introspectionPaths.toVariables(config.getPlatformVariable()));
        DependencyGraph created = new DependencyGraph(TARGET_VARIABLE);
        DependencyNode root = introspection.buildDependencyNode(handle, TARGET_VARIABLE, created);
        graph = created;

        log.debug("Checking the build target for dependencies after platform installation. Existing: {} Missing: {}",
                root.getResolvedDependencies(), root.getUnresolvedReferences());
    }

    /**
     * Register a dependency with the build backend and, when {@code addToGraph},
     * introspect its materialized module into the graph.
     *
     * @return the module's node, if it has one
     */
    public Optional<DependencyNode> addDependency(String variable, ModuleIdentity identity, boolean addToGraph)
            throws IOException {
        if (!registry.register(variable, identity)) {
            log.debug("Dependency {} already registered as {}", variable, identity);
            return registry.node(variable);
        }

        String prefix = overrides.descriptorPrefixFor(variable);
        log.info("Updating build settings for dependency {}: {}", variable, identity);
        SettingsUpdater.update(backend.settings(), expander.expand(identity, prefix), true);
        backend.registerDependency(prefix);

        Path modulePath = layout.pathFor(identity);
        backend.runCheckoutReset(modulePath, CONFIGURE_DIR);

        if (!addToGraph) {
            return Optional.empty();
        }

        checkGraphIsReady();
        ConfigFileHandle handle;
        try {
            handle = introspection.locateConfigFile(modulePath,
                    introspectionPaths.toVariables(config.getPlatformVariable()));
        } catch (NoSuchFileException e) {
            log.warn("Module {} is not materialized at {}; its own dependencies are unknown", variable, modulePath);
            diagnostics.getWarnings().add("Not materialized: " + variable + " at " + modulePath);
            return Optional.empty();
        }
        DependencyNode node = introspection.buildDependencyNode(handle, variable, graph);
        registry.attachNode(variable, node);
        return Optional.of(node);
    }

    @Override
    public void register(String variable, ModuleIdentity identity) throws IOException {
        addDependency(variable, identity, true);
    }

    /**
     * Using the module path convention, find every dependency and register it.
     */
    public DependencyGraph findAllDependencies() throws IOException {
        checkGraphIsReady();
        Files.deleteIfExists(layout.releaseLocalFile());
        return new DependencyResolver(parser, layout, this).resolve(graph, registry, diagnostics);
    }

    public BuildOrder buildOrder() {
        return solver.solve(registry);
    }

    /**
     * Hand the build order to the backend, using descriptor prefixes.
     */
    public BuildOrder updateBuildOrder() {
        return updateBuildOrder(buildOrder());
    }

    public BuildOrder updateBuildOrder(BuildOrder order) {
        List<String> prefixes = new ArrayList<>();
        for (String variable : order.getModules()) {
            prefixes.add(overrides.descriptorPrefixFor(variable));
        }
        backend.setModulesToCompile(prefixes);
        if (order.isDegraded()) {
            diagnostics.getWarnings().add("Build order is degraded; unsatisfied requirements: "
                    + order.getUnsatisfiedRequirements());
        }
        return order;
    }

    public List<DescriptorLine> createDescriptorLines(BuildOrder order) {
        List<DescriptorLine> lines = new ArrayList<>();
        for (String variable : order.withPlatform()) {
            ModuleIdentity identity = registry.identity(variable)
                    .orElseThrow(() -> new IllegalStateException("Unregistered variable in build order: " + variable));
            Map<String, String> settings = expander.expand(identity, overrides.descriptorPrefixFor(variable));
            settings.forEach((key, value) -> lines.add(new DescriptorLine(key, value)));
        }
        return lines;
    }

    public Path writeVersionDescriptor(String name) throws IOException {
        return writeVersionDescriptor(name, buildOrder());
    }

    public Path writeVersionDescriptor(String name, BuildOrder order) throws IOException {
        return descriptorWriter.write(config.getEffectiveDescriptorDir(), name, createDescriptorLines(order));
    }

    /**
     * Point the local release record and every introspected config file at the
     * materialized dependency directories.
     *
     * @return rewritten files with the variables updated in each
     */
    public Map<Path, Set<String>> updateConfigFiles() throws IOException {
        checkGraphIsReady();
        Map<String, String> variables = variablesToPatch();
        Map<Path, Set<String>> patched = new LinkedHashMap<>();

        for (Map.Entry<String, ModuleIdentity> entry : registry.getIdentities().entrySet()) {
            String variable = entry.getKey();
            Path modulePath = layout.pathFor(entry.getValue());
            log.debug("Updating local release record: {}={}", variable, modulePath);
            backend.updateLocalReleaseRecord(variable, modulePath);

            if (variable.equals(config.getPlatformVariable())) {
                continue;
            }
            registry.node(variable).ifPresent(node ->
                    patched.putAll(treeUpdater.update(modulePath, node.getConfigFileRefs(), variables, diagnostics)));
        }

        patched.putAll(treeUpdater.update(config.getTargetPath(), graph.getRoot().getConfigFileRefs(),
                variables, diagnostics));
        return patched;
    }

    /**
     * Every registered dependency mapped to its module directory, plus the configured extras.
     */
    public Map<String, String> variablesToPatch() {
        Map<String, String> variables = new LinkedHashMap<>();
        registry.getIdentities().forEach((variable, identity) ->
                variables.put(variable, layout.pathFor(identity).toString()));
        variables.putAll(config.getExtraPatchVariables());
        return variables;
    }

    /**
     * Skip checkout resets until the returned handle is closed.
     */
    public ScopedOverride suppressCheckoutResets() {
        return backend.override(BackendSlot.withoutCheckoutReset(backend.current()));
    }

    private void checkGraphIsReady() {
        if (graph == null) {
            throw new IllegalStateException("Platform version not yet set");
        }
        if (!Files.isDirectory(introspectionPaths.getPlatformBase())) {
            throw new IllegalStateException("Platform for introspection / building not present: "
                    + introspectionPaths.getPlatformBase());
        }
    }

    public DependencyRegistry getRegistry() {
        return registry;
    }

    public Optional<DependencyGraph> getGraph() {
        return Optional.ofNullable(graph);
    }

    public ToolDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public IntrospectionPaths getIntrospectionPaths() {
        return introspectionPaths;
    }
}
