package no.cantara.depguard;

import no.cantara.depguard.model.DepKind;
import no.cantara.depguard.model.DepSpec;
import no.cantara.depguard.model.DependencyDecl;
import no.cantara.depguard.model.Location;
import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.model.PackageMeta;
import no.cantara.depguard.model.WorkspaceDependency;
import no.cantara.depguard.model.WorkspaceModel;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a workspace model handed over as YAML by the manifest-reading collaborator.
 *
 * <pre>
 * repo_root: .
 * workspace_dependencies:
 *   serde: { version: "1.0" }
 * manifests:
 *   - path: crates/app/Cargo.toml
 *     package: { name: app, publish: true }
 *     features: { json: ["dep:serde_json"] }
 *     dependencies:
 *       - { name: serde, kind: dependencies, version: "1.0", line: 7 }
 * </pre>
 *
 * A dependency's {@code line}/{@code col} become its location inside the manifest.
 * Versions are strings and must be quoted when they look numeric. Values of the wrong
 * type are rejected with {@link IllegalArgumentException} naming the field.
 */
public class WorkspaceModelParser {

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public static WorkspaceModel parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    public static WorkspaceModel parse(InputStream is) {
        Object document;
        try {
            document = YAML.load(is);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Malformed workspace model: " + e.getMessage(), e);
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Workspace model must be a mapping");
        }
        return fromMap(asMap(document, "root"));
    }

    public static WorkspaceModel fromMap(Map<String, Object> data) {
        Map<String, WorkspaceDependency> shared = new LinkedHashMap<>();
        Object rawShared = data.get("workspace_dependencies");
        if (rawShared != null) {
            asMap(rawShared, "workspace_dependencies").forEach((name, value) -> {
                String field = "workspace_dependencies." + name;
                Map<String, Object> d = value == null ? Map.of() : asMap(value, field);
                shared.put(name, new WorkspaceDependency(
                        name,
                        string(d, "version", field + ".version"),
                        string(d, "path", field + ".path"),
                        flag(d, "workspace", field + ".workspace")));
            });
        }

        List<ManifestModel> manifests = new ArrayList<>();
        for (Object m : asList(data.get("manifests"), "manifests")) {
            manifests.add(parseManifest(asMap(m, "manifest")));
        }
        String repoRoot = string(data, "repo_root", "repo_root");
        return new WorkspaceModel(repoRoot != null ? repoRoot : ".", shared, manifests);
    }

    private static ManifestModel parseManifest(Map<String, Object> m) {
        String path = string(m, "path", "manifest.path");
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("manifest: 'path' is required");
        }

        PackageMeta pkg = null;
        if (m.get("package") != null) {
            Map<String, Object> p = asMap(m.get("package"), path + ": package");
            // packages are publishable unless they opt out
            Boolean publish = bool(p, "publish", path + ": package.publish");
            pkg = new PackageMeta(string(p, "name", path + ": package.name"), !Boolean.FALSE.equals(publish));
        }

        Map<String, List<String>> features = new LinkedHashMap<>();
        if (m.get("features") != null) {
            Map<String, Object> raw = asMap(m.get("features"), path + ": features");
            for (String name : raw.keySet()) {
                features.put(name, stringList(raw, name, path + ": features." + name));
            }
        }

        List<DependencyDecl> deps = new ArrayList<>();
        for (Object d : asList(m.get("dependencies"), path + ": dependencies")) {
            deps.add(parseDependency(path, asMap(d, path + ": dependency")));
        }
        return new ManifestModel(path, pkg, features, deps);
    }

    private static DependencyDecl parseDependency(String manifestPath, Map<String, Object> d) {
        String name = string(d, "name", manifestPath + ": dependency.name");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(manifestPath + ": dependency 'name' is required");
        }
        String field = manifestPath + ": " + name + ".";
        String section = string(d, "kind", field + "kind");
        DepKind kind = DepKind.fromSection(section != null ? section : "dependencies");
        DepSpec spec = DepSpec.builder()
                .version(string(d, "version", field + "version"))
                .path(string(d, "path", field + "path"))
                .workspace(flag(d, "workspace", field + "workspace"))
                .git(string(d, "git", field + "git"))
                .branch(string(d, "branch", field + "branch"))
                .tag(string(d, "tag", field + "tag"))
                .rev(string(d, "rev", field + "rev"))
                .defaultFeatures(bool(d, "default_features", field + "default_features"))
                .optional(flag(d, "optional", field + "optional"))
                .build();
        Location location = null;
        Integer line = integer(d, "line", field + "line");
        Integer col = integer(d, "col", field + "col");
        if (line != null) {
            location = new Location(manifestPath, line, col);
        }
        return new DependencyDecl(kind, name, spec, location, string(d, "target", field + "target"));
    }

    /** YAML reads an unquoted {@code 1.10} as the number 1.1, so versions must be quoted. */
    private static String string(Map<String, Object> m, String key, String field) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof String s) return s;
        throw typeError(field, "a string" + (v instanceof Number ? " (quote numeric values)" : ""));
    }

    private static Integer integer(Map<String, Object> m, String key, String field) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof Integer i) return i;
        throw typeError(field, "an integer");
    }

    private static Boolean bool(Map<String, Object> m, String key, String field) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof Boolean b) return b;
        throw typeError(field, "a boolean");
    }

    private static boolean flag(Map<String, Object> m, String key, String field) {
        return Boolean.TRUE.equals(bool(m, key, field));
    }

    private static List<String> stringList(Map<String, Object> m, String key, String field) {
        List<String> out = new ArrayList<>();
        for (Object item : asList(m.get(key), field)) {
            if (!(item instanceof String s)) {
                throw typeError(field, "a list of strings");
            }
            out.add(s);
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node, String context) {
        if (!(node instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException(context + " must be a mapping");
        }
        for (Object key : raw.keySet()) {
            if (!(key instanceof String)) {
                throw new IllegalArgumentException(context + " must be a mapping with string keys");
            }
        }
        return (Map<String, Object>) raw;
    }

    private static List<?> asList(Object node, String context) {
        if (node == null) return List.of();
        if (!(node instanceof List<?> list)) {
            throw new IllegalArgumentException(context + " must be a list");
        }
        return list;
    }

    private static IllegalArgumentException typeError(String field, String expected) {
        return new IllegalArgumentException("'" + field + "' must be " + expected);
    }
}
