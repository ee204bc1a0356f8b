package no.cantara.depguard.report;

import no.cantara.depguard.check.CheckIds;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The explain catalogue: guidance for every check id and every finding code.
 * Code entries share the text of their check under a code-specific title.
 */
public final class Explanations {

    private Explanations() {}

    // ── Check-level entries ───────────────────────────────────────────────────────

    private static final Explanation NO_WILDCARDS = new Explanation(
        "No Wildcard Versions",
        """
        Detects dependencies declared with wildcard version requirements such as `*` or `1.*`.
        A wildcard lets any version be selected, including breaking releases, so builds are
        not reproducible over time and registries refuse to publish such packages.""",
        """
        Replace the wildcard with an explicit requirement: `1.2.3` or `^1.2.3` for compatible
        updates, `~1.2.3` for patch updates only, `=1.2.3` for an exact pin.""");

    private static final Explanation PATH_REQUIRES_VERSION = new Explanation(
        "Path Dependencies Require Version",
        """
        Detects local path dependencies in publishable packages that carry no version.
        A published package is resolved from the registry, where the path means nothing;
        without a version the package cannot be published or built by its users.
        Packages with `publish = false` are exempt unless `ignore_publish_false` is set.""",
        """
        Add `version = "x.y.z"` next to `path = ...`, inherit the dependency with
        `workspace = true`, or mark the package `publish = false`.""");

    private static final Explanation PATH_SAFETY = new Explanation(
        "Path Dependency Safety",
        """
        Detects path dependencies that are absolute (`/home/me/lib`, `C:\\code\\lib`) or whose
        `..` segments climb above the repository root. Such paths depend on one machine's
        directory layout and point at code that is not versioned with the project.""",
        """
        Use repository-relative paths that stay inside the repository. For code outside it,
        depend on a registry release or a git URL, or move the code into the workspace.""");

    private static final Explanation WORKSPACE_INHERITANCE = new Explanation(
        "Workspace Dependency Inheritance",
        """
        Detects dependencies that are defined in the shared workspace dependency table but
        declared again in a member without `workspace = true`. Local copies drift away from
        the shared version and make bulk upgrades error-prone.""",
        """
        Declare the dependency with `workspace = true`; local features may still be added.
        If a different version is intended, add the name to the check's allow list.""");

    private static final Explanation GIT_REQUIRES_VERSION = new Explanation(
        "Git Dependencies Require Version",
        """
        Detects git dependencies in publishable packages that carry no version. The registry
        ignores the git source on publish and needs a version to resolve the dependency.""",
        """
        Add `version = "x.y.z"` alongside `git = ...`, or inherit the dependency from the
        workspace with `workspace = true`.""");

    private static final Explanation DEV_ONLY_IN_NORMAL = new Explanation(
        "Dev-only Crate in Normal Dependencies",
        """
        Detects well-known test, mocking, snapshot and benchmarking crates (for example
        `proptest`, `mockall`, `insta`, `criterion`) declared as production dependencies.
        They inflate the build of every consumer and are rarely needed at runtime.""",
        """
        Move the dependency to the dev-dependencies section. If production code really
        needs it, add the name to the check's allow list.""");

    private static final Explanation DEFAULT_FEATURES_EXPLICIT = new Explanation(
        "Explicit default-features",
        """
        Detects inline dependency tables (path, git or optional dependencies) that do not
        state `default-features`. Whether default features are wanted is then implicit and
        easy to get wrong when the dependency changes its defaults.""",
        """
        Add `default-features = true` or `default-features = false` to the declaration.""");

    private static final Explanation NO_MULTIPLE_VERSIONS = new Explanation(
        "No Multiple Versions",
        """
        Detects a dependency declared with different versions in different members of the
        workspace. Several versions of one crate increase build time and binary size and
        can lead to type mismatches between members.""",
        """
        Align every member on one version, preferably by defining it once in the shared
        workspace dependency table and inheriting it with `workspace = true`.""");

    private static final Explanation OPTIONAL_UNUSED = new Explanation(
        "Unused Optional Dependency",
        """
        Detects optional dependencies that no feature of the same package enables, either
        as `dep:name`, `name/feature`, `name?/feature` or a bare `name`. Such a dependency
        can never be activated.""",
        """
        Add a feature that enables the dependency, or remove `optional = true`.""");

    private static final Map<String, Explanation> BY_CHECK = Map.ofEntries(
        Map.entry(CheckIds.DEPS_NO_WILDCARDS,              NO_WILDCARDS),
        Map.entry(CheckIds.DEPS_PATH_REQUIRES_VERSION,     PATH_REQUIRES_VERSION),
        Map.entry(CheckIds.DEPS_PATH_SAFETY,               PATH_SAFETY),
        Map.entry(CheckIds.DEPS_WORKSPACE_INHERITANCE,     WORKSPACE_INHERITANCE),
        Map.entry(CheckIds.DEPS_GIT_REQUIRES_VERSION,      GIT_REQUIRES_VERSION),
        Map.entry(CheckIds.DEPS_DEV_ONLY_IN_NORMAL,        DEV_ONLY_IN_NORMAL),
        Map.entry(CheckIds.DEPS_DEFAULT_FEATURES_EXPLICIT, DEFAULT_FEATURES_EXPLICIT),
        Map.entry(CheckIds.DEPS_NO_MULTIPLE_VERSIONS,      NO_MULTIPLE_VERSIONS),
        Map.entry(CheckIds.DEPS_OPTIONAL_UNUSED,           OPTIONAL_UNUSED)
    );

    // ── Code-level entries ────────────────────────────────────────────────────────

    private static final Map<String, Explanation> BY_CODE = Map.ofEntries(
        Map.entry(CheckIds.CODE_WILDCARD_VERSION,             retitle(NO_WILDCARDS, "Wildcard Version")),
        Map.entry(CheckIds.CODE_PATH_WITHOUT_VERSION,         retitle(PATH_REQUIRES_VERSION, "Path Without Version")),
        Map.entry(CheckIds.CODE_ABSOLUTE_PATH,                new Explanation(
            "Absolute Path Dependency",
            """
            The dependency path is absolute. It only resolves on machines with the same
            directory layout and may leak details of the host file system.""",
            PATH_SAFETY.remediation())),
        Map.entry(CheckIds.CODE_PARENT_ESCAPE,                new Explanation(
            "Path Escapes Repository Root",
            """
            The dependency path climbs above the repository root with `..` segments, so the
            dependency lives outside version control and breaks fresh checkouts and CI.""",
            PATH_SAFETY.remediation())),
        Map.entry(CheckIds.CODE_MISSING_WORKSPACE_TRUE,       retitle(WORKSPACE_INHERITANCE, "Missing workspace = true")),
        Map.entry(CheckIds.CODE_GIT_WITHOUT_VERSION,          retitle(GIT_REQUIRES_VERSION, "Git Without Version")),
        Map.entry(CheckIds.CODE_DEV_DEP_IN_NORMAL,            retitle(DEV_ONLY_IN_NORMAL, "Dev Dependency in Normal Section")),
        Map.entry(CheckIds.CODE_DEFAULT_FEATURES_IMPLICIT,    retitle(DEFAULT_FEATURES_EXPLICIT, "Implicit default-features")),
        Map.entry(CheckIds.CODE_DUPLICATE_DIFFERENT_VERSIONS, retitle(NO_MULTIPLE_VERSIONS, "Duplicate Different Versions")),
        Map.entry(CheckIds.CODE_OPTIONAL_NOT_IN_FEATURES,     retitle(OPTIONAL_UNUSED, "Optional Not in Features"))
    );

    // ── Lookup ────────────────────────────────────────────────────────────────────

    /** Looks up a check id first, then a finding code. */
    public static Optional<Explanation> lookup(String identifier) {
        if (identifier == null) return Optional.empty();
        Explanation e = BY_CHECK.get(identifier);
        return Optional.ofNullable(e != null ? e : BY_CODE.get(identifier));
    }

    public static List<String> allCheckIds() {
        return CheckIds.ALL_CHECKS;
    }

    public static List<String> allCodes() {
        return CheckIds.ALL_CODES;
    }

    /** Plain-text rendering for the {@code explain} command. */
    public static String format(String identifier, Explanation e) {
        return e.title() + " (" + identifier + ")\n\n"
                + e.description() + "\n\n"
                + "Remediation:\n" + e.remediation() + "\n";
    }

    private static Explanation retitle(Explanation e, String title) {
        return new Explanation(title, e.description(), e.remediation());
    }
}
