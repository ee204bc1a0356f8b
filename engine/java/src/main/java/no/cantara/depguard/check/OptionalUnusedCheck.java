package no.cantara.depguard.check;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Fingerprints;
import no.cantara.depguard.model.DependencyDecl;
import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.CheckPolicy;
import no.cantara.depguard.policy.EffectiveConfig;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Flags optional dependencies that no feature of the same manifest enables.
 */
public final class OptionalUnusedCheck implements Check {

    @Override
    public String id() {
        return CheckIds.DEPS_OPTIONAL_UNUSED;
    }

    @Override
    public void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out) {
        Optional<CheckPolicy> policy = config.checkPolicy(id());
        if (policy.isEmpty()) return;
        Allowlist allow = Allowlist.of(policy.get().allow());

        for (ManifestModel manifest : model.manifests()) {
            Set<String> referenced = referencedNames(manifest);

            for (DependencyDecl dep : manifest.dependencies()) {
                if (!dep.spec().optional() || referenced.contains(dep.name())) continue;
                if (allow.isAllowed(dep.name())) continue;

                out.add(FindingData.forDependency(id(), CheckIds.CODE_OPTIONAL_NOT_IN_FEATURES, policy.get(), manifest, dep)
                        .message("optional dependency '" + dep.name() + "' is not referenced in any feature")
                        .help("Add a feature that enables this dependency, or remove `optional = true`.")
                        .fingerprint(Fingerprints.forDependency(id(), CheckIds.CODE_OPTIONAL_NOT_IN_FEATURES,
                                manifest.path(), dep.name(), null))
                        .build());
            }
        }
    }

    /**
     * Names referenced by any feature token: {@code dep:name}, {@code name/feature}
     * (or the weak {@code name?/feature}), or a bare {@code name}.
     */
    static Set<String> referencedNames(ManifestModel manifest) {
        Set<String> names = new HashSet<>();
        for (List<String> tokens : manifest.features().values()) {
            for (String token : tokens) {
                if (token.startsWith("dep:")) {
                    names.add(token.substring(4));
                } else if (token.indexOf('/') >= 0) {
                    String name = token.substring(0, token.indexOf('/'));
                    names.add(name.endsWith("?") ? name.substring(0, name.length() - 1) : name);
                } else {
                    names.add(token);
                }
            }
        }
        return names;
    }
}
