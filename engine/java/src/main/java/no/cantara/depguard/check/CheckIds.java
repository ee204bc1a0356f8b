package no.cantara.depguard.check;

import java.util.List;

/**
 * Stable identifiers for checks and finding codes.
 *
 * <p>A check id is a dotted namespace; a code is a short snake_case discriminator.
 */
public final class CheckIds {

    private CheckIds() {}

    public static final String DEPS_NO_WILDCARDS = "deps.no_wildcards";
    public static final String DEPS_PATH_REQUIRES_VERSION = "deps.path_requires_version";
    public static final String DEPS_PATH_SAFETY = "deps.path_safety";
    public static final String DEPS_WORKSPACE_INHERITANCE = "deps.workspace_inheritance";
    public static final String DEPS_GIT_REQUIRES_VERSION = "deps.git_requires_version";
    public static final String DEPS_DEV_ONLY_IN_NORMAL = "deps.dev_only_in_normal";
    public static final String DEPS_DEFAULT_FEATURES_EXPLICIT = "deps.default_features_explicit";
    public static final String DEPS_NO_MULTIPLE_VERSIONS = "deps.no_multiple_versions";
    public static final String DEPS_OPTIONAL_UNUSED = "deps.optional_unused";

    public static final String CODE_WILDCARD_VERSION = "wildcard_version";
    public static final String CODE_PATH_WITHOUT_VERSION = "path_without_version";
    public static final String CODE_ABSOLUTE_PATH = "absolute_path";
    public static final String CODE_PARENT_ESCAPE = "parent_escape";
    public static final String CODE_MISSING_WORKSPACE_TRUE = "missing_workspace_true";
    public static final String CODE_GIT_WITHOUT_VERSION = "git_without_version";
    public static final String CODE_DEV_DEP_IN_NORMAL = "dev_dep_in_normal";
    public static final String CODE_DEFAULT_FEATURES_IMPLICIT = "default_features_implicit";
    public static final String CODE_DUPLICATE_DIFFERENT_VERSIONS = "duplicate_different_versions";
    public static final String CODE_OPTIONAL_NOT_IN_FEATURES = "optional_not_in_features";

    // Tool-level, used when a run cannot complete
    public static final String TOOL_RUNTIME = "tool.runtime";
    public static final String CODE_RUNTIME_ERROR = "runtime_error";

    // Fix actions carried in finding data
    public static final String FIX_ACTION_PIN_VERSION = "pin_version";
    public static final String FIX_ACTION_ADD_VERSION = "add_version";
    public static final String FIX_ACTION_ADD_VERSION_WITH_GIT = "add_version_with_git";
    public static final String FIX_ACTION_USE_WORKSPACE = "use_workspace_dependency";
    public static final String FIX_ACTION_MOVE_TO_DEV = "move_to_dev_dependencies";

    /** Every dependency check id, in registration order. */
    public static final List<String> ALL_CHECKS = List.of(
            DEPS_NO_WILDCARDS,
            DEPS_PATH_REQUIRES_VERSION,
            DEPS_PATH_SAFETY,
            DEPS_WORKSPACE_INHERITANCE,
            DEPS_GIT_REQUIRES_VERSION,
            DEPS_DEV_ONLY_IN_NORMAL,
            DEPS_DEFAULT_FEATURES_EXPLICIT,
            DEPS_NO_MULTIPLE_VERSIONS,
            DEPS_OPTIONAL_UNUSED);

    public static final List<String> ALL_CODES = List.of(
            CODE_WILDCARD_VERSION,
            CODE_PATH_WITHOUT_VERSION,
            CODE_ABSOLUTE_PATH,
            CODE_PARENT_ESCAPE,
            CODE_MISSING_WORKSPACE_TRUE,
            CODE_GIT_WITHOUT_VERSION,
            CODE_DEV_DEP_IN_NORMAL,
            CODE_DEFAULT_FEATURES_IMPLICIT,
            CODE_DUPLICATE_DIFFERENT_VERSIONS,
            CODE_OPTIONAL_NOT_IN_FEATURES);
}
