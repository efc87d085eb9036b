package com.modulestack.resolver.introspection;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.model.DependencyGraph;
import com.modulestack.resolver.model.DependencyNode;
import com.modulestack.resolver.spi.ConfigFileHandle;
import com.modulestack.resolver.spi.IntrospectionCollaborator;

/**
 * Introspects modules through their {@code configure/RELEASE} files.
 *
 * Handles column-zero assignments ({@code =}, {@code :=}, {@code ?=}, {@code +=}),
 * {@code $(VAR)} / {@code ${VAR}} references and {@code include} / {@code -include}
 * lines. Every variable holding an absolute path is a dependency: resolved when the
 * directory exists, missing otherwise. Resolved dependencies that carry their own
 * release file are introspected into the same graph.
 */
public class ReleaseFileIntrospector implements IntrospectionCollaborator {
    private static final Logger log = LoggerFactory.getLogger(ReleaseFileIntrospector.class);

    public static final String RELEASE_FILE = "configure/RELEASE";
    public static final String TOP_VARIABLE = "TOP";

    private static final Pattern ASSIGNMENT = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_.-]*)\\s*(\\?=|:=|\\+=|=)\\s*(.*?)\\s*$");
    private static final Pattern INCLUDE = Pattern.compile("^(-?)include\\s+(.+?)\\s*$");
    private static final Pattern REFERENCE = Pattern.compile("\\$(?:\\(([A-Za-z0-9_.-]+)\\)|\\{([A-Za-z0-9_.-]+)\\})");

    @Override
    public ConfigFileHandle locateConfigFile(Path path, Map<String, String> introspectionVariables) throws IOException {
        Path moduleDir;
        Path configFile;
        if (Files.isRegularFile(path)) {
            configFile = path;
            Path parent = path.toAbsolutePath().getParent();
            moduleDir = parent.getFileName() != null && parent.getFileName().toString().equals("configure")
                    ? parent.getParent()
                    : parent;
        } else {
            moduleDir = path;
            configFile = path.resolve(RELEASE_FILE);
        }
        if (!Files.isRegularFile(configFile)) {
            throw new NoSuchFileException(configFile.toString(), null, "No release file for module");
        }
        return ConfigFileHandle.builder()
                .moduleDirectory(moduleDir.toAbsolutePath().normalize())
                .configFile(configFile.toAbsolutePath().normalize())
                .variables(introspectionVariables)
                .build();
    }

    @Override
    public DependencyNode buildDependencyNode(ConfigFileHandle handle,
                                              String variableName,
                                              DependencyGraph rootGraph) throws IOException {
        Optional<DependencyNode> existing = rootGraph.findNode(variableName);
        if (existing.isPresent()) {
            return existing.get();
        }

        Path moduleDir = handle.getModuleDirectory();
        Map<String, String> values = new LinkedHashMap<>(handle.getVariables());
        values.put(TOP_VARIABLE, moduleDir.toString());

        List<String> configFiles = new ArrayList<>();
        Set<String> assigned = new LinkedHashSet<>();
        read(handle.getConfigFile(), moduleDir, values, assigned, configFiles, new HashSet<>(), true);

        Map<String, Path> resolved = new LinkedHashMap<>();
        Map<String, String> missing = new LinkedHashMap<>();
        for (String variable : assigned) {
            String value = values.get(variable);
            if (variable.equals(TOP_VARIABLE) || variable.equals(variableName)
                    || value == null || !value.startsWith("/")) {
                continue;
            }
            Path dependencyPath = Path.of(value).normalize();
            if (Files.isDirectory(dependencyPath)) {
                resolved.put(variable, dependencyPath);
            } else {
                missing.put(variable, value);
            }
        }

        DependencyNode node = new DependencyNode(variableName, resolved, missing, configFiles);
        rootGraph.addNode(node);
        log.debug("Introspected {}: {} resolved, {} missing", variableName, resolved.size(), missing.size());

        for (Map.Entry<String, Path> dependency : resolved.entrySet()) {
            Path release = dependency.getValue().resolve(RELEASE_FILE);
            if (!rootGraph.contains(dependency.getKey()) && Files.isRegularFile(release)) {
                buildDependencyNode(locateConfigFile(dependency.getValue(), handle.getVariables()),
                        dependency.getKey(), rootGraph);
            }
        }
        return node;
    }

    private void read(Path file,
                      Path moduleDir,
                      Map<String, String> values,
                      Set<String> assigned,
                      List<String> configFiles,
                      Set<Path> seen,
                      boolean required) throws IOException {
        Path normalized = file.toAbsolutePath().normalize();
        if (!seen.add(normalized)) {
            return;
        }
        if (!Files.isRegularFile(normalized)) {
            if (required) {
                log.warn("Included file not found: {}", normalized);
            }
            return;
        }
        configFiles.add(moduleDir.relativize(normalized).toString());

        List<String> lines = Files.readAllLines(normalized, StandardCharsets.ISO_8859_1);
        for (String line : joinContinuations(lines)) {
            if (line.isEmpty() || Character.isWhitespace(line.charAt(0)) || line.startsWith("#")) {
                continue;
            }
            Matcher include = INCLUDE.matcher(line);
            if (include.matches()) {
                Path included = Path.of(expand(include.group(2), values));
                if (!included.isAbsolute()) {
                    included = normalized.getParent().resolve(included);
                }
                read(included, moduleDir, values, assigned, configFiles, seen, include.group(1).isEmpty());
                continue;
            }
            Matcher assignment = ASSIGNMENT.matcher(line);
            if (!assignment.matches()) {
                continue;
            }
            String name = assignment.group(1);
            String operator = assignment.group(2);
            String value = expand(assignment.group(3), values);
            switch (operator) {
                case "?=" -> values.putIfAbsent(name, value);
                case "+=" -> values.merge(name, value, (old, added) -> old.isEmpty() ? added : old + " " + added);
                default -> values.put(name, value);
            }
            assigned.add(name);
        }
    }

    private static List<String> joinContinuations(List<String> lines) {
        List<String> joined = new ArrayList<>();
        StringBuilder current = null;
        for (String line : lines) {
            if (current != null) {
                current.append(' ').append(line.trim());
            } else {
                current = new StringBuilder(line);
            }
            if (current.length() > 0 && current.charAt(current.length() - 1) == '\\') {
                current.setLength(current.length() - 1);
                continue;
            }
            joined.add(current.toString());
            current = null;
        }
        if (current != null) {
            joined.add(current.toString());
        }
        return joined;
    }

    private static String expand(String raw, Map<String, String> values) {
        String result = raw;
        // Bounded expansion depth.
        for (int depth = 0; depth < 16; depth++) {
            Matcher matcher = REFERENCE.matcher(result);
            if (!matcher.find()) {
                return result;
            }
            StringBuilder sb = new StringBuilder();
            matcher.reset();
            while (matcher.find()) {
                String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
                matcher.appendReplacement(sb, Matcher.quoteReplacement(values.getOrDefault(name, "")));
            }
            matcher.appendTail(sb);
            result = sb.toString();
        }
        return result;
    }
}
