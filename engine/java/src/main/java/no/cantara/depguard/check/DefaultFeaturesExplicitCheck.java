package no.cantara.depguard.check;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Fingerprints;
import no.cantara.depguard.model.DepSpec;
import no.cantara.depguard.model.DependencyDecl;
import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.CheckPolicy;
import no.cantara.depguard.policy.EffectiveConfig;

import java.util.List;
import java.util.Optional;

/**
 * Flags inline dependency tables (path, git or optional) that leave
 * {@code default-features} implicit. Inheriting and version-only specs are exempt.
 */
public final class DefaultFeaturesExplicitCheck implements Check {

    @Override
    public String id() {
        return CheckIds.DEPS_DEFAULT_FEATURES_EXPLICIT;
    }

    @Override
    public void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out) {
        Optional<CheckPolicy> policy = config.checkPolicy(id());
        if (policy.isEmpty()) return;
        Allowlist allow = Allowlist.of(policy.get().allow());

        for (ManifestModel manifest : model.manifests()) {
            for (DependencyDecl dep : manifest.dependencies()) {
                DepSpec spec = dep.spec();
                if (spec.workspace() || !hasInlineOptions(spec) || spec.defaultFeatures() != null) continue;
                if (allow.isAllowed(dep.name())) continue;

                out.add(FindingData.forDependency(id(), CheckIds.CODE_DEFAULT_FEATURES_IMPLICIT, policy.get(), manifest, dep)
                        .message("dependency '" + dep.name()
                                + "' has inline options but no explicit default-features declaration")
                        .help("Add `default-features = true` or `default-features = false` to make the intent explicit.")
                        .fingerprint(Fingerprints.forDependency(id(), CheckIds.CODE_DEFAULT_FEATURES_IMPLICIT,
                                manifest.path(), dep.name(), null))
                        .data("current_spec", spec.toData())
                        .build());
            }
        }
    }

    private static boolean hasInlineOptions(DepSpec spec) {
        return spec.path() != null || spec.git() != null || spec.optional();
    }
}
