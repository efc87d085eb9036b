package com.modulestack.resolver.patch;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites variable assignments in generated build-configuration files.
 *
 * Only column-zero assignments are considered: empty lines, lines starting with
 * whitespace (recipes, continuations) and comments are kept verbatim. A file in
 * which nothing changes is never written.
 */
public class ConfigPatcher {
    private static final Logger log = LoggerFactory.getLogger(ConfigPatcher.class);

    /**
     * Checked in this order; {@code =} is a substring of the other two.
     */
    public static final List<String> ASSIGNMENT_OPERATORS = List.of("?=", ":=", "=");

    private static final String COMMENT_MARKER = "#";

    // Single-byte charset: every byte round-trips, whatever the file's real encoding.
    private static final Charset FILE_CHARSET = StandardCharsets.ISO_8859_1;

    /**
     * Patch {@code file} with the given variable values.
     *
     * @return the variables whose assignment lines were rewritten
     */
    public Set<String> patch(Path file, Map<String, String> variableToValue) throws IOException {
        String content = Files.readString(file, FILE_CHARSET);
        String lineSeparator = content.contains("\r\n") ? "\r\n" : "\n";

        Set<String> updated = new LinkedHashSet<>();
        List<String> output = new ArrayList<>();
        content.lines().forEach(line -> output.add(patchLine(line, variableToValue, updated)));

        if (updated.isEmpty()) {
            log.debug("Config file left unchanged: {}", file);
            return updated;
        }

        StringBuilder rewritten = new StringBuilder(String.join(lineSeparator, output));
        if (content.endsWith("\n") || content.endsWith("\r")) {
            rewritten.append(lineSeparator);
        }
        log.warn("Patching config file {} variables {}", file, String.join(", ", updated));
        Files.writeString(file, rewritten, FILE_CHARSET);
        return updated;
    }

    /**
     * Patch a single line, adding the variable name to {@code updated} when it is rewritten.
     */
    public String patchLine(String line, Map<String, String> variableToValue, Set<String> updated) {
        if (line.isEmpty()) {
            return line;
        }
        char first = line.charAt(0);
        if (Character.isWhitespace(first) || line.startsWith(COMMENT_MARKER)) {
            return line;
        }

        for (String operator : ASSIGNMENT_OPERATORS) {
            int index = line.indexOf(operator);
            if (index < 0) {
                continue;
            }
            String variable = line.substring(0, index).trim();
            if (!variableToValue.containsKey(variable)) {
                continue;
            }
            String fixed = variable + operator + variableToValue.get(variable);
            updated.add(variable);
            log.debug("Fixed config line: {}", fixed);
            return fixed;
        }
        return line;
    }
}
