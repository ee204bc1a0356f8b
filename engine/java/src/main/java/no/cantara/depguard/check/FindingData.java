package no.cantara.depguard.check;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.model.DependencyDecl;
import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.policy.CheckPolicy;

/**
 * Shared construction of dependency findings.
 */
final class FindingData {

    private FindingData() {}

    /**
     * A builder pre-filled with severity, location, and the {@code dependency},
     * {@code manifest}, {@code section} and {@code target} data entries.
     */
    static Finding.Builder forDependency(String checkId, String code, CheckPolicy policy,
                                         ManifestModel manifest, DependencyDecl dep) {
        return Finding.builder(policy.severity(), checkId, code)
                .location(dep.location())
                .data("dependency", dep.name())
                .data("manifest", manifest.path())
                .data("section", dep.kind().sectionName())
                .data("target", dep.target());
    }
}
