package com.modulestack.resolver.cli.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ResolveCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedResolveOptions {
	Path targetPath;
	Path cacheDir;
	List<String> rootPrefixes;
	Map<String, String> patchVariables;
}
