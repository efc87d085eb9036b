package com.modulestack.resolver.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.modulestack.resolver.cli.exception.OptionsValidationException;
import com.modulestack.resolver.cli.model.ResolveOptions;
import com.modulestack.resolver.cli.model.ValidatedResolveOptions;
import com.modulestack.resolver.convention.PathConventionParser;

public class ResolveOptionsValidator {

	public static final Path DEFAULT_CACHE_DIR = Path.of("cache");

	/**
	 * Always patched unless the command line gives another value.
	 */
	public static final Map<String, String> DEFAULT_PATCH_VARIABLES = Map.of("RE2C", "re2c");

	private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	public ValidatedResolveOptions validate(ResolveOptions o) {
		List<String> errors = new ArrayList<>();

		Path targetPath = null;
		if (o.getTarget() == null) {
			errors.add("A target module or application path is required.");
		} else {
			targetPath = o.getTarget().toAbsolutePath().normalize();
			if (!Files.exists(targetPath)) {
				errors.add("Target does not exist: " + targetPath);
			}
		}

		if (isBlank(o.getPlatformTag())) {
			errors.add("Platform tag must not be blank (--platform-tag / -b).");
		}
		if (o.getPlatformVariable() == null || !VARIABLE_NAME.matcher(o.getPlatformVariable()).matches()) {
			errors.add("Platform variable is not a valid build variable name: " + o.getPlatformVariable());
		}
		if (isBlank(o.getRepoOwner())) {
			errors.add("Repository owner must not be blank (--repo-owner).");
		}
		if (isBlank(o.getDescriptorName()) || o.getDescriptorName().contains("/")) {
			errors.add("Version descriptor name must be a plain file name. Got: " + o.getDescriptorName());
		}

		Path cacheDir = (o.getCacheDir() == null ? DEFAULT_CACHE_DIR : o.getCacheDir()).toAbsolutePath().normalize();
		if (Files.exists(cacheDir) && !Files.isDirectory(cacheDir)) {
			errors.add("Cache directory is not a directory: " + cacheDir);
		}

		List<String> rootPrefixes = parseRootPrefixes(o.getRootPrefixes(), errors);
		Map<String, String> patchVariables = parsePatches(o.getPatches(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedResolveOptions(targetPath, cacheDir, rootPrefixes, patchVariables);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static List<String> parseRootPrefixes(List<String> raw, List<String> errors) {
		if (raw == null || raw.isEmpty()) {
			return PathConventionParser.DEFAULT_ROOT_PREFIXES;
		}
		List<String> result = new ArrayList<>();
		for (String prefix : raw) {
			String trimmed = prefix == null ? "" : prefix.trim();
			if (!trimmed.startsWith("/")) {
				errors.add("Root prefix must be an absolute path: " + prefix);
			} else {
				result.add(trimmed);
			}
		}
		return result;
	}

	private static Map<String, String> parsePatches(List<String> raw, List<String> errors) {
		Map<String, String> result = new LinkedHashMap<>(DEFAULT_PATCH_VARIABLES);
		if (raw == null) {
			return result;
		}
		for (String entry : raw) {
			int separator = entry.indexOf('=');
			String name = separator < 0 ? entry : entry.substring(0, separator).trim();
			if (separator < 0 || !VARIABLE_NAME.matcher(name).matches()) {
				errors.add("Patch must look like NAME=VALUE. Got: " + entry);
				continue;
			}
			result.put(name, entry.substring(separator + 1).trim());
		}
		return result;
	}
}
