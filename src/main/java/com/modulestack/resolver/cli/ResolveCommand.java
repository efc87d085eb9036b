package com.modulestack.resolver.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.backend.LocalBuildBackend;
import com.modulestack.resolver.cli.exception.OptionsValidationException;
import com.modulestack.resolver.cli.model.ResolveOptions;
import com.modulestack.resolver.cli.model.ValidatedResolveOptions;
import com.modulestack.resolver.cli.output.ResolveResultsPrinter;
import com.modulestack.resolver.cli.validation.ResolveOptionsValidator;
import com.modulestack.resolver.convention.ModulePathLayout;
import com.modulestack.resolver.introspection.ReleaseFileIntrospector;
import com.modulestack.resolver.model.core.context.IntrospectionPaths;
import com.modulestack.resolver.model.core.context.ResolverConfig;
import com.modulestack.resolver.session.ModuleStackSession;
import com.modulestack.resolver.session.ResolutionSummary;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that prepares a module or application: registers its dependency
 * stack, writes the version descriptor, patches config files and computes the
 * build order.
 */
@Command(
        name = "module-stack-resolver",
        mixinStandardHelpOptions = true,
        version = "module-stack-resolver 1.0.0",
        description = "Resolves the module dependency stack of a build target and prepares it for building."
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_DEGRADED = 3;

    private static final String BASE_LOGGER = "com.modulestack";

    @Mixin
    private ResolveOptions options = new ResolveOptions();

    private final ResolveOptionsValidator validator = new ResolveOptionsValidator();
    private final ResolveResultsPrinter printer = new ResolveResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedResolveOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return EXIT_FAILURE;
        }

        ResolverConfig config = toConfig(options, validated);
        printer.printBanner(config);

        try {
            ModuleStackSession session = new ModuleStackSession(config, new ReleaseFileIntrospector(),
                    new LocalBuildBackend(new ModulePathLayout(config.getModuleCacheDir()).releaseLocalFile()));
            ResolutionSummary summary = session.prepare();

            if (!summary.isSuccess()) {
                printer.printFailure(summary);
                return EXIT_FAILURE;
            }

            printer.printSuccess(summary);
            if (options.isStrict() && summary.isDegraded()) {
                log.error("Build order is degraded and --strict was given");
                return EXIT_DEGRADED;
            }
            return EXIT_OK;

        } catch (Exception e) {
            log.error("Resolution failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    static ResolverConfig toConfig(ResolveOptions o, ValidatedResolveOptions v) {
        IntrospectionPaths.IntrospectionPathsBuilder paths = IntrospectionPaths.defaults().toBuilder();
        if (o.getSiteTop() != null) {
            paths.siteTop(o.getSiteTop().toAbsolutePath().normalize());
        }
        if (o.getModulesDir() != null) {
            paths.modules(o.getModulesDir().toAbsolutePath().normalize());
        }

        return ResolverConfig.builder()
                .targetPath(v.getTargetPath())
                .cacheDir(v.getCacheDir())
                .descriptorDir(o.getDescriptorDir() != null ? o.getDescriptorDir().toAbsolutePath().normalize() : null)
                .descriptorName(o.getDescriptorName())
                .platformTag(o.getPlatformTag())
                .platformVariable(o.getPlatformVariable())
                .repoOwner(o.getRepoOwner())
                .rootPrefixes(v.getRootPrefixes())
                .introspectionPaths(paths.build())
                .extraPatchVariables(v.getPatchVariables())
                .resetConfigure(!o.isNoReset())
                .build();
    }

    private static void enableDebugLogging() {
        Logger base = LoggerFactory.getLogger(BASE_LOGGER);
        if (base instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) base).setLevel(Level.DEBUG);
        }
    }
}
