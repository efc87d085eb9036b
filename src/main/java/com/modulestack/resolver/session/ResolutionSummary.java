package com.modulestack.resolver.session;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.modulestack.resolver.model.BuildOrder;
import com.modulestack.resolver.model.ModuleIdentity;
import com.modulestack.resolver.model.core.context.ToolDiagnostics;

import lombok.Builder;
import lombok.Data;

/**
 * Result of preparing a build target.
 */
@Data
@Builder
public class ResolutionSummary {
    private boolean success;
    private String errorMessage;

    private Map<String, ModuleIdentity> registeredModules;
    private BuildOrder buildOrder;
    private Path descriptorFile;
    private Map<Path, Set<String>> patchedFiles;
    private Map<String, Map<String, String>> unresolvedReferences;
    private ToolDiagnostics diagnostics;

    public boolean isDegraded() {
        return buildOrder != null && buildOrder.isDegraded();
    }

    public List<String> getModulesToBuild() {
        return buildOrder != null ? buildOrder.getModules() : List.of();
    }

    public static ResolutionSummary failure(String errorMessage) {
        return ResolutionSummary.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
