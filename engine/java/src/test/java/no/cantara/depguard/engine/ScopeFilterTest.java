package no.cantara.depguard.engine;

import no.cantara.depguard.model.DepSpec;
import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.model.WorkspaceDependency;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.Scope;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static no.cantara.depguard.TestModels.*;
import static org.junit.jupiter.api.Assertions.*;

class ScopeFilterTest {

    private static final WorkspaceModel MODEL = workspace(
            Map.of("serde", new WorkspaceDependency("serde", "1", null, false)),
            manifest("Cargo.toml", dep("serde", DepSpec.inherited())),
            manifest("crates/a/Cargo.toml", dep("serde", DepSpec.ofVersion("1"))),
            manifest("crates/b/Cargo.toml", dep("rand", DepSpec.ofVersion("0.8"))));

    @Test
    void repoScopeKeepsEverything() {
        assertSame(MODEL, ScopeFilter.apply(MODEL, Scope.REPO, null));
    }

    @Test
    void diffScopeKeepsRootAndChangedManifests() {
        WorkspaceModel filtered = ScopeFilter.apply(MODEL, Scope.DIFF, List.of("./crates/b/Cargo.toml", "README.md"));

        assertEquals(List.of("Cargo.toml", "crates/b/Cargo.toml"),
                filtered.manifests().stream().map(ManifestModel::path).toList());
        assertEquals(MODEL.workspaceDependencies(), filtered.workspaceDependencies());
    }

    @Test
    void windowsSeparatorsMatch() {
        WorkspaceModel filtered = ScopeFilter.apply(MODEL, Scope.DIFF, List.of("crates\\a\\Cargo.toml"));
        assertEquals(2, filtered.manifests().size());
    }

    @Test
    void diffScopeRequiresChangedFiles() {
        assertThrows(IllegalArgumentException.class, () -> ScopeFilter.apply(MODEL, Scope.DIFF, null));
    }
}
