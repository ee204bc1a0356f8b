package no.cantara.depguard.engine;

import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.model.RepoPaths;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.Scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Narrows a workspace model to the manifests a change touched.
 *
 * <p>In {@link Scope#DIFF} the first (root) manifest is always kept, since it carries
 * the shared dependency table; every other manifest is kept only when its path is in
 * the changed-file list.
 */
public final class ScopeFilter {

    private ScopeFilter() {}

    /**
     * @param changedFiles repo-relative paths from the revision-control collaborator;
     *                     required for {@link Scope#DIFF}, ignored for {@link Scope#REPO}
     * @throws IllegalArgumentException if the scope is DIFF and no changed files are given
     */
    public static WorkspaceModel apply(WorkspaceModel model, Scope scope, Collection<String> changedFiles) {
        if (scope == Scope.REPO) {
            return model;
        }
        if (changedFiles == null) {
            throw new IllegalArgumentException("diff scope requires a changed-file list");
        }
        Set<String> changed = changedFiles.stream().map(RepoPaths::normalize).collect(Collectors.toSet());

        List<ManifestModel> kept = new ArrayList<>();
        for (int i = 0; i < model.manifests().size(); i++) {
            ManifestModel m = model.manifests().get(i);
            if (i == 0 || changed.contains(m.path())) {
                kept.add(m);
            }
        }
        return new WorkspaceModel(model.repoRoot(), model.workspaceDependencies(), kept);
    }
}
