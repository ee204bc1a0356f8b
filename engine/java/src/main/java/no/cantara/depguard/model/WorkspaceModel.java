package no.cantara.depguard.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The workspace under evaluation: shared dependency definitions and every manifest in scope.
 *
 * @param repoRoot              identifier of the workspace root
 * @param workspaceDependencies shared definitions keyed by dependency name
 * @param manifests             manifests, root first
 */
public record WorkspaceModel(
        String repoRoot,
        Map<String, WorkspaceDependency> workspaceDependencies,
        List<ManifestModel> manifests
) {
    public WorkspaceModel {
        repoRoot = repoRoot != null ? repoRoot : ".";
        workspaceDependencies = workspaceDependencies != null
                ? Collections.unmodifiableMap(new TreeMap<>(workspaceDependencies))
                : Map.of();
        manifests = manifests != null ? List.copyOf(manifests) : List.of();
    }

    public WorkspaceModel(List<ManifestModel> manifests) {
        this(".", Map.of(), manifests);
    }

    /** Total number of declarations across all manifests. */
    public int dependencyCount() {
        return manifests.stream().mapToInt(m -> m.dependencies().size()).sum();
    }
}
