package com.modulestack.resolver.convention;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modulestack.resolver.model.ModuleIdentity;

/**
 * Extracts a {@link ModuleIdentity} from a module path laid out as
 * {@code <rootPrefix>/<base>/modules/<name>/<tag>[/]}.
 *
 * Root prefixes are tried in registration order and the first match wins.
 * Patterns are matched against the whole absolute, symlink-resolved path.
 * A path that matches no pattern is an expected outcome, not an error.
 */
public class PathConventionParser {
    private static final Logger log = LoggerFactory.getLogger(PathConventionParser.class);

    public static final List<String> DEFAULT_ROOT_PREFIXES = List.of(
            "/cds/group/pcds/epics",
            "/reg/g/pcds/epics"
    );

    private static final String MODULE_PATH_TEMPLATE =
            "/(?<base>[^/]+)/modules/(?<name>[^/]+)/(?<tag>[^/]+)/?";

    private final List<String> rootPrefixes;
    private final List<Pattern> patterns;

    public PathConventionParser() {
        this(DEFAULT_ROOT_PREFIXES);
    }

    public PathConventionParser(List<String> rootPrefixes) {
        Objects.requireNonNull(rootPrefixes, "rootPrefixes");
        this.rootPrefixes = List.copyOf(rootPrefixes);
        List<Pattern> compiled = new ArrayList<>();
        for (String prefix : this.rootPrefixes) {
            compiled.add(Pattern.compile(Pattern.quote(stripTrailingSlash(prefix)) + MODULE_PATH_TEMPLATE));
        }
        this.patterns = List.copyOf(compiled);
    }

    public List<String> getRootPrefixes() {
        return rootPrefixes;
    }

    public Optional<ModuleIdentity> parse(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Optional.empty();
        }
        try {
            return parse(Path.of(rawPath.trim()));
        } catch (InvalidPathException e) {
            log.debug("Not a usable path: {}", rawPath);
            return Optional.empty();
        }
    }

    public Optional<ModuleIdentity> parse(Path path) {
        if (path == null) {
            return Optional.empty();
        }
        String resolved = resolve(path).toString();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(resolved);
            if (matcher.matches()) {
                return Optional.of(ModuleIdentity.builder()
                        .base(matcher.group("base"))
                        .name(matcher.group("name"))
                        .tag(matcher.group("tag"))
                        .build());
            }
        }
        return Optional.empty();
    }

    /**
     * Absolute, normalized path with symlinks resolved for the longest existing prefix.
     * The remainder (which does not exist yet) is appended unchanged.
     */
    static Path resolve(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        Path existing = absolute;
        while (existing != null) {
            try {
                Path real = existing.toRealPath();
                return existing.equals(absolute) ? real : real.resolve(existing.relativize(absolute));
            } catch (IOException e) {
                existing = existing.getParent();
            }
        }
        return absolute;
    }

    private static String stripTrailingSlash(String prefix) {
        String result = prefix;
        while (result.length() > 1 && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
