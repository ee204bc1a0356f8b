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
 * Flags declarations that duplicate a shared workspace dependency locally instead of
 * inheriting it with {@code workspace = true}.
 */
public final class WorkspaceInheritanceCheck implements Check {

    @Override
    public String id() {
        return CheckIds.DEPS_WORKSPACE_INHERITANCE;
    }

    @Override
    public void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out) {
        Optional<CheckPolicy> policy = config.checkPolicy(id());
        if (policy.isEmpty() || model.workspaceDependencies().isEmpty()) return;
        Allowlist allow = Allowlist.of(policy.get().allow());

        for (ManifestModel manifest : model.manifests()) {
            for (DependencyDecl dep : manifest.dependencies()) {
                if (!model.workspaceDependencies().containsKey(dep.name())) continue;
                if (dep.spec().workspace() || allow.isAllowed(dep.name())) continue;

                out.add(FindingData.forDependency(id(), CheckIds.CODE_MISSING_WORKSPACE_TRUE, policy.get(), manifest, dep)
                        .message("dependency '" + dep.name()
                                + "' exists in [workspace.dependencies] but is not declared with `workspace = true`")
                        .help("Prefer `workspace = true` to inherit the workspace dependency version and features.")
                        .fingerprint(Fingerprints.forDependency(id(), CheckIds.CODE_MISSING_WORKSPACE_TRUE,
                                manifest.path(), dep.name(), dep.spec().path()))
                        .data("current_spec", dep.spec().toData())
                        .data("workspace_version", model.workspaceDependencies().get(dep.name()).version())
                        .data("fix_action", CheckIds.FIX_ACTION_USE_WORKSPACE)
                        .data("fix_hint", "Replace with `workspace = true`")
                        .build());
            }
        }
    }
}
