package no.cantara.depguard;

import no.cantara.depguard.engine.DepguardEngine;
import no.cantara.depguard.engine.DomainReport;
import no.cantara.depguard.model.DepKind;
import no.cantara.depguard.model.DependencyDecl;
import no.cantara.depguard.model.Location;
import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.config.ConfigResolver;
import no.cantara.depguard.config.DepguardConfig;
import no.cantara.depguard.config.Overrides;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceModelParserTest {

    private static WorkspaceModel loadFixture() throws Exception {
        try (InputStream is = WorkspaceModelParserTest.class.getClassLoader()
                .getResourceAsStream("fixtures/workspace/workspace.yaml")) {
            assertNotNull(is, "fixture missing");
            return WorkspaceModelParser.parse(is);
        }
    }

    private static WorkspaceModel parse(String yaml) {
        return WorkspaceModelParser.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void parseFixture() throws Exception {
        WorkspaceModel model = loadFixture();

        assertEquals(".", model.repoRoot());
        assertEquals(List.of("serde", "tokio"), List.copyOf(model.workspaceDependencies().keySet()));
        assertEquals("1", model.workspaceDependencies().get("tokio").version());
        assertEquals(3, model.manifests().size());
        assertEquals(8, model.dependencyCount());
    }

    @Test
    void rootManifestIsVirtual() throws Exception {
        ManifestModel root = loadFixture().manifests().get(0);
        assertNull(root.packageMeta());
        assertFalse(root.isPublishable());
        assertTrue(root.dependencies().get(0).spec().workspace());
    }

    @Test
    void memberManifestDetails() throws Exception {
        ManifestModel app = loadFixture().manifests().get(1);

        assertEquals("crates/app/Cargo.toml", app.path());
        assertEquals("app", app.packageName().orElseThrow());
        assertTrue(app.isPublishable());
        assertEquals(List.of("dep:serde_json"), app.features().get("json"));
        assertEquals(List.of(), app.features().get("default"));

        List<DependencyDecl> deps = app.dependencies();
        assertEquals("1.0", deps.get(0).spec().version());
        assertEquals(new Location("crates/app/Cargo.toml", 8, 1), deps.get(0).location());
        assertTrue(deps.get(1).spec().optional());
        assertEquals(Boolean.FALSE, deps.get(2).spec().defaultFeatures());
        assertEquals("../core", deps.get(2).spec().path());
        assertEquals(DepKind.DEV, deps.get(3).kind());
        assertEquals(DepKind.BUILD, deps.get(4).kind());
        assertNull(deps.get(4).location());
        assertEquals("cfg(windows)", deps.get(5).target());
    }

    @Test
    void publishFalseIsNotPublishable() throws Exception {
        ManifestModel internal = loadFixture().manifests().get(2);
        assertFalse(internal.isPublishable());
        assertEquals("main", internal.dependencies().get(0).spec().branch());
    }

    @Test
    void fixtureEvaluatesUnderStrictProfile() throws Exception {
        DomainReport report = DepguardEngine.evaluate(loadFixture(),
                ConfigResolver.resolve(DepguardConfig.empty(), Overrides.none()));

        // serde duplicated locally, core without version, internal git dep exempt as unpublished
        List<String> codes = report.findings().stream().map(f -> f.code()).toList();
        assertTrue(codes.contains("missing_workspace_true"));
        assertTrue(codes.contains("path_without_version"));
        assertFalse(codes.contains("git_without_version"));
        assertTrue(codes.contains("default_features_implicit"));
    }

    @Test
    void missingRequiredFieldsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> parse("manifests:\n  - dependencies: []\n"));
        assertThrows(IllegalArgumentException.class,
                () -> parse("manifests:\n  - path: Cargo.toml\n    dependencies:\n      - { version: '1' }\n"));
        assertThrows(IllegalArgumentException.class,
                () -> parse("manifests:\n  - path: Cargo.toml\n    dependencies:\n      - { name: x, kind: peer }\n"));
    }

    @Test
    void malformedDocumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> parse("manifests: [\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("- a\n- b\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("manifests: nope\n"));
    }

    @Test
    void wronglyTypedValuesAreRejectedByTheReader() {
        String manifest = "manifests:\n  - path: Cargo.toml\n";
        List<String> bad = List.of(
                manifest + "    features: { f: [1] }\n    dependencies:\n      - { name: x, version: '1', optional: true }\n",
                "manifests:\n  - path: 7\n",
                manifest + "    package: { name: [a] }\n",
                manifest + "    package: { name: a, publish: 'no' }\n",
                manifest + "    dependencies:\n      - { name: 5 }\n",
                manifest + "    dependencies:\n      - { name: x, path: [a] }\n",
                manifest + "    dependencies:\n      - { name: x, git: 3 }\n",
                manifest + "    dependencies:\n      - { name: x, version: '1', line: 3, col: 'one' }\n",
                manifest + "    dependencies:\n      - { name: x, version: '1', line: 'three' }\n",
                manifest + "    dependencies:\n      - { name: x, version: '1', target: 1 }\n",
                manifest + "    dependencies:\n      - { name: x, version: '1', default_features: 'false' }\n",
                "workspace_dependencies:\n  serde: { path: 1 }\nmanifests: []\n");
        for (String yaml : bad) {
            assertThrows(IllegalArgumentException.class, () -> parse(yaml), yaml);
        }
    }

    @Test
    void featureTokenErrorNamesTheField() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parse("manifests:\n  - path: Cargo.toml\n    features: { f: [1] }\n"));
        assertTrue(e.getMessage().contains("features.f"), e.getMessage());
    }

    @Test
    void unquotedNumericVersionsAreRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parse("manifests:\n  - path: Cargo.toml\n    dependencies:\n      - { name: serde, version: 1.10 }\n"));
        assertTrue(e.getMessage().contains("serde.version"), e.getMessage());
        assertThrows(IllegalArgumentException.class,
                () -> parse("workspace_dependencies:\n  tokio: { version: 1 }\nmanifests: []\n"));

        WorkspaceModel model = parse("manifests:\n  - path: Cargo.toml\n    dependencies:\n      - { name: serde, version: '1.10' }\n");
        assertEquals("1.10", model.manifests().get(0).dependencies().get(0).spec().version());
    }
}
