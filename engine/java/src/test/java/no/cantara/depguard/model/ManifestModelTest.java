package no.cantara.depguard.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManifestModelTest {

    @Test
    void virtualManifestIsNotPublishable() {
        ManifestModel m = new ManifestModel("Cargo.toml", null, List.of());
        assertFalse(m.isPublishable());
        assertTrue(m.packageName().isEmpty());
    }

    @Test
    void packageWithPublishFlag() {
        ManifestModel published = new ManifestModel("Cargo.toml", PackageMeta.publishable("depguard"), List.of());
        assertTrue(published.isPublishable());
        assertEquals("depguard", published.packageName().orElseThrow());

        ManifestModel internal = new ManifestModel("Cargo.toml", new PackageMeta("private", false), List.of());
        assertFalse(internal.isPublishable());
        assertEquals("private", internal.packageName().orElseThrow());
    }

    @Test
    void pathIsNormalized() {
        assertEquals("crates/a/Cargo.toml", new ManifestModel("./crates\\a\\Cargo.toml", null, List.of()).path());
        assertEquals(".", new ManifestModel("", null, List.of()).path());
    }

    @Test
    void collectionsAreCopied() {
        List<DependencyDecl> deps = new ArrayList<>();
        deps.add(DependencyDecl.normal("serde", DepSpec.ofVersion("1.0")));
        ManifestModel m = new ManifestModel("Cargo.toml", null, Map.of("json", List.of("dep:serde")), deps);
        deps.clear();

        assertEquals(1, m.dependencies().size());
        assertThrows(UnsupportedOperationException.class, () -> m.dependencies().add(null));
        assertThrows(UnsupportedOperationException.class, () -> m.features().put("x", List.of()));
    }

    @Test
    void workspaceCountsDependencies() {
        WorkspaceModel ws = new WorkspaceModel(List.of(
                new ManifestModel("Cargo.toml", null, List.of(DependencyDecl.normal("a", DepSpec.ofVersion("1")))),
                new ManifestModel("b/Cargo.toml", null, List.of(
                        DependencyDecl.normal("b", DepSpec.ofVersion("1")),
                        DependencyDecl.normal("c", DepSpec.ofVersion("1"))))));
        assertEquals(3, ws.dependencyCount());
        assertEquals(".", ws.repoRoot());
    }

    @Test
    void inheritingSpecIsNotIndependentlyVersioned() {
        DepSpec spec = DepSpec.builder().workspace(true).version("1.0").build();
        assertFalse(spec.isIndependentlyVersioned());
        assertTrue(DepSpec.ofVersion("1.0").isIndependentlyVersioned());
        assertFalse(DepSpec.ofPath("../x").isIndependentlyVersioned());
    }

    @Test
    void specDataHoldsOnlySetFields() {
        DepSpec spec = DepSpec.builder().version("1.0").git("https://example.org/x.git").defaultFeatures(false).build();
        Map<String, Object> data = spec.toData();
        assertEquals(List.of("default-features", "git", "version"), List.copyOf(data.keySet()));
        assertEquals(false, data.get("default-features"));
    }

    @Test
    void kindSectionNames() {
        assertEquals("dev-dependencies", DepKind.DEV.sectionName());
        assertEquals(DepKind.BUILD, DepKind.fromSection("build-dependencies"));
        assertEquals(DepKind.NORMAL, DepKind.fromSection("normal"));
        assertThrows(IllegalArgumentException.class, () -> DepKind.fromSection("peer-dependencies"));
    }
}
