package com.modulestack.resolver.model.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Run-wide diagnostics (errors/warnings/info) accumulated while resolving a target.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
