package com.modulestack.resolver.spi;

import java.nio.file.Path;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A located build-configuration file, ready to be introspected.
 */
@Value
@Builder(toBuilder = true)
public class ConfigFileHandle {

    /**
     * Top directory of the module the file belongs to.
     */
    @NonNull
    Path moduleDirectory;

    @NonNull
    Path configFile;

    /**
     * Variables predefined while reading the file.
     */
    @NonNull
    @Singular
    Map<String, String> variables;
}
