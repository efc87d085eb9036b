package com.modulestack.resolver.cli.output;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.model.BuildOrder;
import com.modulestack.resolver.model.ModuleIdentity;
import com.modulestack.resolver.model.core.context.ResolverConfig;
import com.modulestack.resolver.model.core.context.ToolDiagnostics;
import com.modulestack.resolver.session.ResolutionSummary;

/**
 * Responsible only for printing CLI output for the "resolve" command.
 * No validation, no execution.
 */
public class ResolveResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResolveResultsPrinter.class);

    public void printBanner(ResolverConfig config) {
        log.info("=================================================");
        log.info("Module Stack Resolver");
        log.info("=================================================");
        log.info("Target: {}", config.getTargetPath());
        log.info("Platform: {}={}", config.getPlatformVariable(), config.getPlatformTag());
        log.info("Module Cache: {}", config.getModuleCacheDir());
        log.info("Version Descriptor: {}/{}", config.getEffectiveDescriptorDir(), config.getDescriptorName());
        log.info("Repository Owner: {}", config.getRepoOwner());
        log.info("Root Prefixes: {}", String.join(", ", config.getRootPrefixes()));
        if (!config.getExtraPatchVariables().isEmpty()) {
            log.info("Extra Patch Variables: {}", config.getExtraPatchVariables());
        }
        if (!config.isResetConfigure()) {
            log.info("Configure resets: disabled");
        }
        log.info("=================================================");
    }

    public void printSuccess(ResolutionSummary summary) {
        log.info("");
        log.info("=================================================");
        log.info(summary.isDegraded() ? "RESOLUTION FINISHED (DEGRADED BUILD ORDER)" : "RESOLUTION SUCCESSFUL");
        log.info("=================================================");

        log.info("Registered Modules: {}", summary.getRegisteredModules().size());
        for (Map.Entry<String, ModuleIdentity> entry : summary.getRegisteredModules().entrySet()) {
            log.info("  {} = {}", entry.getKey(), entry.getValue());
        }

        BuildOrder order = summary.getBuildOrder();
        log.info("");
        log.info("Build Order: {}", String.join(" -> ", order.withPlatform()));
        if (order.isDegraded()) {
            log.warn("Build order could not be fully determined. Unsatisfied requirements:");
            order.getUnsatisfiedRequirements().forEach((variable, missing) ->
                    log.warn("  {} requires {}", variable, missing));
        }

        if (!summary.getUnresolvedReferences().isEmpty()) {
            log.info("");
            log.info("Unresolved References:");
            summary.getUnresolvedReferences().forEach((owner, refs) ->
                    refs.forEach((variable, path) -> log.info("  {}: {}={}", owner, variable, path)));
        }

        log.info("");
        log.info("Patched Files: {}", summary.getPatchedFiles().size());
        for (Map.Entry<Path, Set<String>> entry : summary.getPatchedFiles().entrySet()) {
            log.info("  {} ({})", entry.getKey(), String.join(", ", entry.getValue()));
        }

        log.info("");
        log.info("Version Descriptor: {}", summary.getDescriptorFile());
        printDiagnostics(summary.getDiagnostics());
        log.info("=================================================");
    }

    public void printFailure(ResolutionSummary summary) {
        log.error("Resolution failed: {}", summary.getErrorMessage());
        printDiagnostics(summary.getDiagnostics());
    }

    private void printDiagnostics(ToolDiagnostics diagnostics) {
        if (diagnostics == null) {
            return;
        }
        diagnostics.getErrors().forEach(e -> log.error("  error: {}", e));
        diagnostics.getWarnings().forEach(w -> log.warn("  warning: {}", w));
        diagnostics.getInfos().forEach(i -> log.info("  info: {}", i));
    }
}
