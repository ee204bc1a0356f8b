package no.cantara.depguard.config;

import no.cantara.depguard.check.CheckIds;
import no.cantara.depguard.policy.EffectiveConfig;
import no.cantara.depguard.policy.Severity;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DepguardConfigParserTest {

    @Test
    void parseFullConfigFixture() throws Exception {
        DepguardConfig cfg;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("fixtures/config/depguard.yaml")) {
            assertNotNull(is, "fixture missing");
            cfg = DepguardConfigParser.parse(is);
        }

        assertEquals("depguard.config.v1", cfg.schema());
        assertEquals("compat", cfg.profile());
        assertEquals("repo", cfg.scope());
        assertEquals("warning", cfg.failOn());
        assertEquals(50, cfg.maxFindings());
        assertEquals(List.of(CheckIds.DEPS_NO_WILDCARDS, CheckIds.DEPS_PATH_REQUIRES_VERSION, CheckIds.DEPS_OPTIONAL_UNUSED),
                List.copyOf(cfg.checks().keySet()));

        CheckConfig wildcards = cfg.checks().get(CheckIds.DEPS_NO_WILDCARDS);
        assertEquals(Boolean.TRUE, wildcards.enabled());
        assertEquals("error", wildcards.severity());
        assertEquals(List.of("legacy-*"), wildcards.allow());

        assertEquals(Boolean.TRUE, cfg.checks().get(CheckIds.DEPS_PATH_REQUIRES_VERSION).ignorePublishFalse());
        assertEquals(CheckConfig.empty(), cfg.checks().get(CheckIds.DEPS_OPTIONAL_UNUSED));
    }

    @Test
    void blankTextIsEmptyConfig() {
        assertEquals(DepguardConfig.empty(), DepguardConfigParser.parse(""));
        assertEquals(DepguardConfig.empty(), DepguardConfigParser.parse("  \n"));
        assertEquals(DepguardConfig.empty(), DepguardConfigParser.parse("# only a comment\n"));
    }

    @Test
    void malformedYamlIsParseError() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> DepguardConfigParser.parse("profile: [strict\n"));
        assertEquals(ConfigException.Kind.PARSE, e.kind());
    }

    @Test
    void wrongTypesNameTheField() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> DepguardConfigParser.parse("checks:\n  deps.no_wildcards:\n    enabled: maybe\n"));
        assertEquals(ConfigException.Kind.PARSE, e.kind());
        assertEquals("checks.deps.no_wildcards.enabled", e.subject());

        e = assertThrows(ConfigException.class, () -> DepguardConfigParser.parse("max_findings: lots\n"));
        assertEquals("max_findings", e.subject());

        e = assertThrows(ConfigException.class,
                () -> DepguardConfigParser.parse("checks:\n  deps.path_safety:\n    allow: \"../*\"\n"));
        assertEquals("checks.deps.path_safety.allow", e.subject());

        e = assertThrows(ConfigException.class, () -> DepguardConfigParser.parse("- just\n- a list\n"));
        assertEquals("config", e.subject());
    }

    @Test
    void parsedConfigResolves() {
        DepguardConfig cfg = DepguardConfigParser.parse("""
                profile: warn
                checks:
                  deps.path_safety:
                    severity: error
                """);
        EffectiveConfig effective = ConfigResolver.resolve(cfg, Overrides.none());
        assertEquals(Presets.WARN, effective.profile());
        assertEquals(Severity.ERROR, effective.checkPolicy(CheckIds.DEPS_PATH_SAFETY).orElseThrow().severity());
    }
}
