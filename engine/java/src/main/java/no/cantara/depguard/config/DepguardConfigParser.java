package no.cantara.depguard.config;

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
 * Parses a {@code depguard.yaml} document into a {@link DepguardConfig}.
 */
public class DepguardConfigParser {

    // No arbitrary type instantiation through YAML tags.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public static DepguardConfig parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    public static DepguardConfig parse(InputStream is) {
        try {
            return fromDocument(YAML.load(is));
        } catch (YAMLException e) {
            throw new ConfigException(ConfigException.Kind.PARSE, "config", "parse config: " + e.getMessage(), e);
        }
    }

    /** Empty or blank text is the empty configuration. */
    public static DepguardConfig parse(String text) {
        if (text == null || text.isBlank()) {
            return DepguardConfig.empty();
        }
        try {
            return fromDocument(YAML.load(text));
        } catch (YAMLException e) {
            throw new ConfigException(ConfigException.Kind.PARSE, "config", "parse config: " + e.getMessage(), e);
        }
    }

    private static DepguardConfig fromDocument(Object document) {
        if (document == null) {
            return DepguardConfig.empty();
        }
        return fromMap(asMap(document, "config"));
    }

    public static DepguardConfig fromMap(Map<String, Object> data) {
        Map<String, CheckConfig> checks = new LinkedHashMap<>();
        Object rawChecks = data.get("checks");
        if (rawChecks != null) {
            asMap(rawChecks, "checks").forEach((id, value) ->
                    checks.put(id, value == null ? CheckConfig.empty() : parseCheck(id, asMap(value, "checks." + id))));
        }
        return new DepguardConfig(
                string(data, "schema", "schema"),
                string(data, "profile", "profile"),
                string(data, "scope", "scope"),
                string(data, "fail_on", "fail_on"),
                integer(data, "max_findings", "max_findings"),
                checks);
    }

    private static CheckConfig parseCheck(String id, Map<String, Object> c) {
        String prefix = "checks." + id + ".";
        return new CheckConfig(
                bool(c, "enabled", prefix + "enabled"),
                string(c, "severity", prefix + "severity"),
                stringList(c, "allow", prefix + "allow"),
                bool(c, "ignore_publish_false", prefix + "ignore_publish_false"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node, String field) {
        if (!(node instanceof Map<?, ?> raw)) {
            throw typeError(field, "a mapping");
        }
        for (Object key : raw.keySet()) {
            if (!(key instanceof String)) {
                throw typeError(field, "a mapping with string keys");
            }
        }
        return (Map<String, Object>) raw;
    }

    private static String string(Map<String, Object> m, String key, String field) {
        Object v = m.get(key);
        if (v == null) return null;
        if (v instanceof String s) return s;
        throw typeError(field, "a string");
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

    private static List<String> stringList(Map<String, Object> m, String key, String field) {
        Object v = m.get(key);
        if (v == null) return List.of();
        if (!(v instanceof List<?> list)) {
            throw typeError(field, "a list of strings");
        }
        List<String> out = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof String s)) {
                throw typeError(field, "a list of strings");
            }
            out.add(s);
        }
        return out;
    }

    private static ConfigException typeError(String field, String expected) {
        return new ConfigException(ConfigException.Kind.PARSE, field, "'" + field + "' must be " + expected);
    }
}
