package com.modulestack.resolver.patch;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.model.core.context.ToolDiagnostics;

/**
 * Patches the config files one module references, restricted to files inside the module.
 *
 * A failure on one file is logged and recorded, and the remaining files are still patched.
 */
public class ConfigTreeUpdater {
    private static final Logger log = LoggerFactory.getLogger(ConfigTreeUpdater.class);

    private final ConfigPatcher patcher;

    public ConfigTreeUpdater(ConfigPatcher patcher) {
        this.patcher = Objects.requireNonNull(patcher, "patcher");
    }

    /**
     * @return files that were rewritten, with the variables updated in each
     */
    public Map<Path, Set<String>> update(Path moduleDir,
                                         List<String> configFileRefs,
                                         Map<String, String> variableToValue,
                                         ToolDiagnostics diagnostics) {
        Path base = moduleDir.toAbsolutePath().normalize();
        Map<Path, Set<String>> patched = new LinkedHashMap<>();

        for (String relative : configFileRefs) {
            Path file = base.resolve(relative).normalize();
            try {
                if (!isInside(file, base)) {
                    log.debug("Skipping config file {} (not inside {})", file, base);
                    continue;
                }
                Set<String> updated = patcher.patch(file, variableToValue);
                if (!updated.isEmpty()) {
                    patched.put(file, updated);
                }
            } catch (AccessDeniedException e) {
                log.error("Failed to patch config file due to permissions: {}", file);
                diagnostics.getErrors().add("Permission denied patching " + file);
            } catch (Exception e) {
                log.error("Failed to patch config file: {}", file, e);
                diagnostics.getErrors().add("Failed to patch " + file + " (" + e.getMessage() + ")");
            }
        }
        return patched;
    }

    /**
     * Symlinks are followed for files that exist.
     */
    private static boolean isInside(Path file, Path base) throws IOException {
        if (!file.startsWith(base)) {
            return false;
        }
        if (!Files.exists(file) || !Files.exists(base)) {
            return true;
        }
        return file.toRealPath().startsWith(base.toRealPath());
    }
}
