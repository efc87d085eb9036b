package com.modulestack.resolver.descriptor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.modulestack.resolver.convention.NamingOverrides;
import com.modulestack.resolver.model.ModuleIdentity;
import com.modulestack.resolver.spi.SettingsStore;

/**
 * Expands a module identity into the release settings the build backend consumes:
 * checkout tag, directory, repository coordinates and fetch options, all prefixed
 * with the variable's descriptor prefix.
 */
public class ReleaseSettingsExpander {

    public static final String REPO_OWNER_SETTING = "REPOOWNER";
    public static final String DEFAULT_TAG = "master";

    public static final String SUFFIX_DIRNAME = "_DIRNAME";
    public static final String SUFFIX_REPONAME = "_REPONAME";
    public static final String SUFFIX_REPOOWNER = "_REPOOWNER";
    public static final String SUFFIX_VARNAME = "_VARNAME";
    public static final String SUFFIX_RECURSIVE = "_RECURSIVE";
    public static final String SUFFIX_DEPTH = "_DEPTH";
    public static final String SUFFIX_REPOURL = "_REPOURL";

    private final NamingOverrides overrides;
    private final SettingsStore settings;
    private final String defaultOwner;

    public ReleaseSettingsExpander(NamingOverrides overrides, SettingsStore settings, String defaultOwner) {
        this.overrides = Objects.requireNonNull(overrides, "overrides");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.defaultOwner = Objects.requireNonNull(defaultOwner, "defaultOwner");
    }

    /**
     * @param prefix the descriptor prefix of the variable (already passed through overrides)
     * @return settings in descriptor order
     */
    public Map<String, String> expand(ModuleIdentity identity, String prefix) {
        String owner = overrides.repoOwnerFor(settings.get(REPO_OWNER_SETTING).orElse(defaultOwner));
        String repoName = overrides.repoNameFor(identity.getName());

        Map<String, String> result = new LinkedHashMap<>();
        result.put(prefix, identity.getTag().isEmpty() ? DEFAULT_TAG : identity.getTag());
        result.put(prefix + SUFFIX_DIRNAME, identity.getName());
        result.put(prefix + SUFFIX_REPONAME, repoName);
        result.put(prefix + SUFFIX_REPOOWNER, owner);
        result.put(prefix + SUFFIX_VARNAME, prefix);
        result.put(prefix + SUFFIX_RECURSIVE, "YES");
        result.put(prefix + SUFFIX_DEPTH, "-1");
        result.put(prefix + SUFFIX_REPOURL, "https://github.com/" + owner + "/" + repoName + ".git");
        return result;
    }
}
