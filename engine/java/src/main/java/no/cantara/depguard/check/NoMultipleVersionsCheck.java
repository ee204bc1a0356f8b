package no.cantara.depguard.check;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Fingerprints;
import no.cantara.depguard.model.DependencyDecl;
import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.CheckPolicy;
import no.cantara.depguard.policy.EffectiveConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Flags dependency names declared with more than one distinct version across the
 * workspace. Emits one workspace-level finding per name, without a location.
 */
public final class NoMultipleVersionsCheck implements Check {

    private record Occurrence(String version, String manifest) implements Comparable<Occurrence> {
        @Override
        public int compareTo(Occurrence o) {
            int c = version.compareTo(o.version);
            return c != 0 ? c : manifest.compareTo(o.manifest);
        }
    }

    @Override
    public String id() {
        return CheckIds.DEPS_NO_MULTIPLE_VERSIONS;
    }

    @Override
    public void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out) {
        Optional<CheckPolicy> policy = config.checkPolicy(id());
        if (policy.isEmpty()) return;
        Allowlist allow = Allowlist.of(policy.get().allow());

        Map<String, SortedSet<Occurrence>> byName = new TreeMap<>();
        for (ManifestModel manifest : model.manifests()) {
            for (DependencyDecl dep : manifest.dependencies()) {
                if (!dep.spec().isIndependentlyVersioned()) continue;
                byName.computeIfAbsent(dep.name(), k -> new TreeSet<>())
                        .add(new Occurrence(dep.spec().version(), manifest.path()));
            }
        }

        for (Map.Entry<String, SortedSet<Occurrence>> entry : byName.entrySet()) {
            String name = entry.getKey();
            List<String> versions = entry.getValue().stream().map(Occurrence::version).distinct().toList();
            if (versions.size() <= 1 || allow.isAllowed(name)) continue;

            List<Map<String, Object>> occurrences = new ArrayList<>();
            for (Occurrence o : entry.getValue()) {
                occurrences.add(Map.of("version", o.version(), "manifest", o.manifest()));
            }

            out.add(Finding.builder(policy.get().severity(), id(), CheckIds.CODE_DUPLICATE_DIFFERENT_VERSIONS)
                    .message("crate '" + name + "' has multiple versions across workspace: "
                            + String.join(", ", versions))
                    .help("Align all workspace members to use the same version via [workspace.dependencies].")
                    .fingerprint(Fingerprints.forWorkspace(id(), CheckIds.CODE_DUPLICATE_DIFFERENT_VERSIONS, name))
                    .data("crate", name)
                    .data("versions", versions)
                    .data("occurrences", List.copyOf(occurrences))
                    .build());
        }
    }
}
