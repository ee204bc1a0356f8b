package no.cantara.depguard.config;

import no.cantara.depguard.check.Allowlist;
import no.cantara.depguard.check.GlobSyntaxException;
import no.cantara.depguard.policy.CheckPolicy;
import no.cantara.depguard.policy.EffectiveConfig;
import no.cantara.depguard.policy.FailOn;
import no.cantara.depguard.policy.Scope;
import no.cantara.depguard.policy.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw configuration plus caller overrides into an {@link EffectiveConfig}.
 *
 * <p>Precedence, later wins:
 * <ol>
 *   <li>the preset named by the override or file profile ({@code strict} when absent or unknown)</li>
 *   <li>top-level {@code scope}, {@code fail_on}, {@code max_findings} from the file</li>
 *   <li>per-check settings from the file, merged onto the preset policy; a check the
 *       preset does not know starts from {@link CheckPolicy#disabled()}</li>
 *   <li>caller overrides for {@code scope} and {@code max_findings}</li>
 * </ol>
 *
 * <p>Any invalid value aborts resolution with a {@link ConfigException}.
 */
public final class ConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

    private ConfigResolver() {}

    public static EffectiveConfig resolve(DepguardConfig raw, Overrides overrides) {
        DepguardConfig cfg = raw != null ? raw : DepguardConfig.empty();
        Overrides ovr = overrides != null ? overrides : Overrides.none();

        EffectiveConfig effective = presetPass(cfg, ovr);
        effective = topLevelPass(effective, cfg);
        effective = checksPass(effective, cfg);
        effective = overridePass(effective, ovr);

        log.debug("Resolved profile '{}', scope {}, fail_on {}, max_findings {}, {} check polic(ies)",
                effective.profile(), effective.scope(), effective.failOn(),
                effective.maxFindings(), effective.checks().size());
        return effective;
    }

    static EffectiveConfig presetPass(DepguardConfig cfg, Overrides ovr) {
        String profile = ovr.profile() != null ? ovr.profile() : cfg.profile();
        EffectiveConfig preset = Presets.preset(profile);
        if (profile != null && !Presets.NAMES.contains(profile)) {
            log.warn("Unknown profile '{}'; using '{}'", profile, preset.profile());
        }
        return preset;
    }

    static EffectiveConfig topLevelPass(EffectiveConfig effective, DepguardConfig cfg) {
        EffectiveConfig result = effective;
        if (cfg.scope() != null) {
            result = result.withScope(parseScope("scope", cfg.scope()));
        }
        if (cfg.failOn() != null) {
            FailOn failOn = FailOn.parse(cfg.failOn()).orElseThrow(() -> new ConfigException(
                    ConfigException.Kind.INVALID_FAIL_ON, "fail_on",
                    "unknown fail_on: " + cfg.failOn() + " (expected error|warning)"));
            result = result.withFailOn(failOn);
        }
        if (cfg.maxFindings() != null) {
            result = result.withMaxFindings(checkMaxFindings("max_findings", cfg.maxFindings()));
        }
        return result;
    }

    static EffectiveConfig checksPass(EffectiveConfig effective, DepguardConfig cfg) {
        if (cfg.checks().isEmpty()) return effective;

        Map<String, CheckPolicy> policies = new LinkedHashMap<>(effective.checks());
        for (Map.Entry<String, CheckConfig> entry : cfg.checks().entrySet()) {
            String checkId = entry.getKey();
            CheckConfig cc = entry.getValue() != null ? entry.getValue() : CheckConfig.empty();
            CheckPolicy policy = policies.getOrDefault(checkId, CheckPolicy.disabled());

            if (cc.enabled() != null) {
                policy = policy.withEnabled(cc.enabled());
            }
            if (cc.severity() != null) {
                Severity severity = Severity.parse(cc.severity()).orElseThrow(() -> new ConfigException(
                        ConfigException.Kind.INVALID_SEVERITY, checkId,
                        "invalid severity for " + checkId + ": " + cc.severity()
                                + " (expected info|warning|error)"));
                policy = policy.withSeverity(severity);
            }
            if (!cc.allow().isEmpty()) {
                validateAllowlist(checkId, cc);
                policy = policy.withAllow(cc.allow());
            }
            if (cc.ignorePublishFalse() != null) {
                policy = policy.withIgnorePublishFalse(cc.ignorePublishFalse());
            }
            policies.put(checkId, policy);
        }
        return effective.withChecks(policies);
    }

    static EffectiveConfig overridePass(EffectiveConfig effective, Overrides ovr) {
        EffectiveConfig result = effective;
        if (ovr.scope() != null) {
            result = result.withScope(parseScope("scope", ovr.scope()));
        }
        if (ovr.maxFindings() != null) {
            result = result.withMaxFindings(checkMaxFindings("max_findings", ovr.maxFindings()));
        }
        return result;
    }

    private static void validateAllowlist(String checkId, CheckConfig cc) {
        try {
            Allowlist.of(cc.allow());
        } catch (GlobSyntaxException e) {
            throw new ConfigException(ConfigException.Kind.INVALID_GLOB, checkId,
                    "invalid allow glob for " + checkId + ": " + e.pattern() + " (" + e.getMessage() + ")", e);
        }
    }

    private static Scope parseScope(String field, String value) {
        return Scope.parse(value).orElseThrow(() -> new ConfigException(
                ConfigException.Kind.INVALID_SCOPE, field,
                "unknown scope: " + value + " (expected 'repo' or 'diff')"));
    }

    private static int checkMaxFindings(String field, Integer value) {
        Objects.requireNonNull(value, field);
        if (value < 0) {
            throw new ConfigException(ConfigException.Kind.INVALID_MAX_FINDINGS, field,
                    "max_findings must not be negative: " + value);
        }
        return value;
    }
}
