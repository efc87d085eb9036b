package com.modulestack.resolver.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.modulestack.resolver.model.core.context.ResolverConfig;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "resolve" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ResolveOptions {

	@Parameters(index = "0", arity = "0..1", description = "Module or application to prepare (a directory or its configure/RELEASE file)")
	private Path target;

	@Option(names = { "--platform-tag", "-b" }, defaultValue = ResolverConfig.DEFAULT_PLATFORM_TAG,
			description = "Platform (base) version tag (default: ${DEFAULT-VALUE})")
	private String platformTag;

	@Option(names = { "--platform-variable" }, defaultValue = ResolverConfig.DEFAULT_PLATFORM_VARIABLE,
			description = "Build variable naming the platform (default: ${DEFAULT-VALUE})")
	private String platformVariable;

	@Option(names = { "--cache-dir", "-c" }, description = "Cache directory for materialized modules (default: ./cache)")
	private Path cacheDir;

	@Option(names = { "--set-dir" }, description = "Directory for version descriptors (default: <cache-dir>/sets)")
	private Path descriptorDir;

	@Option(names = { "--set-name" }, defaultValue = ResolverConfig.DEFAULT_DESCRIPTOR_NAME,
			description = "Version descriptor name, written as <name>.set (default: ${DEFAULT-VALUE})")
	private String descriptorName;

	@Option(names = { "--repo-owner" }, defaultValue = ResolverConfig.DEFAULT_REPO_OWNER,
			description = "Default repository owner (default: ${DEFAULT-VALUE})")
	private String repoOwner;

	@Option(names = { "--root-prefix" },
			description = "Module root prefix, repeatable; tried in order (default: /cds/group/pcds/epics, /reg/g/pcds/epics)")
	private List<String> rootPrefixes = new ArrayList<>();

	// Introspection paths
	@Option(names = { "--site-top" }, description = "Site top directory used during introspection")
	private Path siteTop;

	@Option(names = { "--modules-dir" }, description = "Site modules directory used during introspection")
	private Path modulesDir;

	@Option(names = { "--patch", "-p" }, description = "Extra NAME=VALUE to patch into config files, repeatable (RE2C=re2c is always included unless overridden)")
	private List<String> patches = new ArrayList<>();

	@Option(names = { "--no-reset" }, description = "Do not reset configure directories with git before introspection")
	private boolean noReset;

	@Option(names = { "--strict" }, description = "Exit with status 3 when the build order could not be fully determined")
	private boolean strict;

	@Option(names = { "--verbose", "-v" }, description = "Debug logging")
	private boolean verbose;

}
