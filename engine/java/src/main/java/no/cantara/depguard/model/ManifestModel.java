package no.cantara.depguard.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One package manifest of the workspace.
 *
 * @param path         canonical repo-relative path; the sort and identity key
 * @param packageMeta  package table, or {@code null} for a virtual (workspace-only) manifest
 * @param features     feature name to the ordered tokens it enables
 * @param dependencies declared dependencies in declaration order
 */
public record ManifestModel(
        String path,
        PackageMeta packageMeta,
        Map<String, List<String>> features,
        List<DependencyDecl> dependencies
) {
    public ManifestModel {
        path = RepoPaths.normalize(path);
        TreeMap<String, List<String>> sorted = new TreeMap<>();
        if (features != null) {
            features.forEach((k, v) -> sorted.put(k, v != null ? List.copyOf(v) : List.of()));
        }
        features = Collections.unmodifiableMap(sorted);
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public ManifestModel(String path, PackageMeta packageMeta, List<DependencyDecl> dependencies) {
        this(path, packageMeta, Map.of(), dependencies);
    }

    /** Only manifests with a package table that does not opt out of publishing. */
    public boolean isPublishable() {
        return packageMeta != null && packageMeta.publish();
    }

    public Optional<String> packageName() {
        return Optional.ofNullable(packageMeta).map(PackageMeta::name);
    }
}
