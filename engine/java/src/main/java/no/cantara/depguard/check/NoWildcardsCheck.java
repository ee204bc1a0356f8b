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
 * Flags version requirements containing a {@code *} wildcard.
 */
public final class NoWildcardsCheck implements Check {

    @Override
    public String id() {
        return CheckIds.DEPS_NO_WILDCARDS;
    }

    @Override
    public void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out) {
        Optional<CheckPolicy> policy = config.checkPolicy(id());
        if (policy.isEmpty()) return;
        Allowlist allow = Allowlist.of(policy.get().allow());

        for (ManifestModel manifest : model.manifests()) {
            for (DependencyDecl dep : manifest.dependencies()) {
                String version = dep.spec().version();
                if (version == null || !version.contains("*")) continue;
                if (allow.isAllowed(dep.name())) continue;

                out.add(FindingData.forDependency(id(), CheckIds.CODE_WILDCARD_VERSION, policy.get(), manifest, dep)
                        .message("dependency '" + dep.name() + "' uses a wildcard version: " + version)
                        .help("Replace wildcard versions with an explicit semver requirement.")
                        .fingerprint(Fingerprints.forDependency(id(), CheckIds.CODE_WILDCARD_VERSION,
                                manifest.path(), dep.name(), dep.spec().path()))
                        .data("current_spec", dep.spec().toData())
                        .data("fix_action", CheckIds.FIX_ACTION_PIN_VERSION)
                        .data("fix_hint", "Pin to a specific semver requirement")
                        .build());
            }
        }
    }
}
