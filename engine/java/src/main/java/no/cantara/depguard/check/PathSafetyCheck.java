package no.cantara.depguard.check;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Fingerprints;
import no.cantara.depguard.model.DependencyDecl;
import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.CheckPolicy;
import no.cantara.depguard.policy.EffectiveConfig;

import java.util.List;
import java.util.Optional;

/**
 * Flags path dependencies that are absolute or whose {@code ..} segments climb above
 * the workspace root. The allowlist matches against the dependency path.
 */
public final class PathSafetyCheck implements Check {

    @Override
    public String id() {
        return CheckIds.DEPS_PATH_SAFETY;
    }

    @Override
    public void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out) {
        Optional<CheckPolicy> policy = config.checkPolicy(id());
        if (policy.isEmpty()) return;
        Allowlist allow = Allowlist.of(policy.get().allow());

        for (ManifestModel manifest : model.manifests()) {
            int depth = manifestDirDepth(manifest.path());

            for (DependencyDecl dep : manifest.dependencies()) {
                String path = dep.spec().path();
                if (path == null || allow.isAllowed(path)) continue;

                if (isAbsolute(path)) {
                    out.add(finding(CheckIds.CODE_ABSOLUTE_PATH, policy.get(), manifest, dep)
                            .message("dependency '" + dep.name() + "' uses an absolute path: " + path)
                            .help("Use repo-relative paths. Absolute paths are not portable and may leak host layout.")
                            .build());
                } else if (escapesRoot(depth, path)) {
                    out.add(finding(CheckIds.CODE_PARENT_ESCAPE, policy.get(), manifest, dep)
                            .message("dependency '" + dep.name() + "' uses a path that escapes the repo root: " + path)
                            .help("Avoid `..` segments that escape the repository root.")
                            .build());
                }
            }
        }
    }

    private Finding.Builder finding(String code, CheckPolicy policy, ManifestModel manifest, DependencyDecl dep) {
        return FindingData.forDependency(id(), code, policy, manifest, dep)
                .fingerprint(Fingerprints.forDependency(id(), code, manifest.path(), dep.name(), dep.spec().path()))
                .data("path", dep.spec().path());
    }

    /** Leading separator, or a drive letter followed by a colon. */
    static boolean isAbsolute(String path) {
        if (path.startsWith("/") || path.startsWith("\\")) return true;
        return path.length() >= 2 && path.charAt(1) == ':' && Character.isLetter(path.charAt(0));
    }

    /** Number of directories above the manifest file; {@code Cargo.toml} at the root is 0. */
    static int manifestDirDepth(String manifestPath) {
        String[] parts = manifestPath.split("/");
        int depth = 0;
        for (int i = 0; i < parts.length - 1; i++) {
            if (!parts[i].isEmpty() && !parts[i].equals(".")) depth++;
        }
        return depth;
    }

    static boolean escapesRoot(int startDepth, String relativePath) {
        int depth = startDepth;
        for (String segment : relativePath.split("[/\\\\]")) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) {
                depth--;
                if (depth < 0) return true;
            } else {
                depth++;
            }
        }
        return false;
    }
}
