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
 * Flags local-path dependencies of publishable manifests that carry no version and do
 * not inherit one from the workspace. A published package cannot resolve such a path.
 */
public final class PathRequiresVersionCheck implements Check {

    @Override
    public String id() {
        return CheckIds.DEPS_PATH_REQUIRES_VERSION;
    }

    @Override
    public void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out) {
        Optional<CheckPolicy> policy = config.checkPolicy(id());
        if (policy.isEmpty()) return;
        Allowlist allow = Allowlist.of(policy.get().allow());

        for (ManifestModel manifest : model.manifests()) {
            if (!policy.get().ignorePublishFalse() && !manifest.isPublishable()) continue;

            for (DependencyDecl dep : manifest.dependencies()) {
                if (dep.spec().path() == null || dep.spec().version() != null || dep.spec().workspace()) continue;
                if (allow.isAllowed(dep.name())) continue;

                out.add(FindingData.forDependency(id(), CheckIds.CODE_PATH_WITHOUT_VERSION, policy.get(), manifest, dep)
                        .message("dependency '" + dep.name() + "' uses a path dependency without an explicit version")
                        .help("Add an explicit version alongside `path = ...`, or use `workspace = true` with a workspace dependency.")
                        .fingerprint(Fingerprints.forDependency(id(), CheckIds.CODE_PATH_WITHOUT_VERSION,
                                manifest.path(), dep.name(), dep.spec().path()))
                        .data("path", dep.spec().path())
                        .data("current_spec", dep.spec().toData())
                        .data("fix_action", CheckIds.FIX_ACTION_ADD_VERSION)
                        .data("fix_hint", "Add version alongside the path dependency")
                        .build());
            }
        }
    }
}
