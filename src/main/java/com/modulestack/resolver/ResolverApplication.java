package com.modulestack.resolver;

import com.modulestack.resolver.cli.ResolveCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Module Stack Resolver.
 * Prepares a Makefile-driven module or application for building by resolving the
 * versioned modules it depends on from their install paths.
 */
public class ResolverApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ResolveCommand()).execute(args);
        System.exit(exitCode);
    }
}
