package com.modulestack.resolver.model.core.context;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Site paths handed to the introspection collaborator so that the platform's
 * build-system files can be located while reading module configuration.
 */
@Value
@Builder(toBuilder = true)
public class IntrospectionPaths {

    public static final Path DEFAULT_PLATFORM_BASE = Path.of("/cds/group/pcds/epics/base/R7.0.2-2.0");
    public static final Path DEFAULT_SITE_TOP = Path.of("/cds/group/pcds/");
    public static final Path DEFAULT_MODULES = Path.of("/cds/group/pcds/epics/R7.0.2-2.0/modules");

    @NonNull
    Path platformBase;

    @NonNull
    Path siteTop;

    @NonNull
    Path modules;

    public static IntrospectionPaths defaults() {
        return IntrospectionPaths.builder()
                .platformBase(DEFAULT_PLATFORM_BASE)
                .siteTop(DEFAULT_SITE_TOP)
                .modules(DEFAULT_MODULES)
                .build();
    }

    public IntrospectionPaths withPlatformBase(Path platformBase) {
        return toBuilder().platformBase(platformBase).build();
    }

    /**
     * {@code {<platformVariable>: "/path/to/base", "EPICS_SITE_TOP": ..., "EPICS_MODULES": ...}}
     */
    public Map<String, String> toVariables(String platformVariable) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put(platformVariable, platformBase.toAbsolutePath().normalize().toString());
        variables.put("EPICS_SITE_TOP", siteTop.toAbsolutePath().normalize().toString());
        variables.put("EPICS_MODULES", modules.toAbsolutePath().normalize().toString());
        return variables;
    }
}
