package no.cantara.depguard.config;

import no.cantara.depguard.check.CheckIds;
import no.cantara.depguard.policy.CheckPolicy;
import no.cantara.depguard.policy.EffectiveConfig;
import no.cantara.depguard.policy.FailOn;
import no.cantara.depguard.policy.Scope;
import no.cantara.depguard.policy.Severity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Built-in profiles. Any unknown profile name resolves to {@code strict}.
 */
public final class Presets {

    public static final String STRICT = "strict";
    public static final String WARN = "warn";
    public static final String COMPAT = "compat";

    public static final Set<String> NAMES = Set.of(STRICT, WARN, COMPAT);

    static final int DEFAULT_MAX_FINDINGS = 200;

    private Presets() {}

    public static EffectiveConfig preset(String profile) {
        if (profile == null) return strict();
        return switch (profile) {
            case WARN -> new EffectiveConfig(WARN, Scope.REPO, FailOn.WARNING, DEFAULT_MAX_FINDINGS,
                    allChecks(Severity.WARNING));
            // mostly on, but findings stay warnings and only errors fail
            case COMPAT -> new EffectiveConfig(COMPAT, Scope.REPO, FailOn.ERROR, DEFAULT_MAX_FINDINGS,
                    allChecks(Severity.WARNING));
            default -> strict();
        };
    }

    private static EffectiveConfig strict() {
        return new EffectiveConfig(STRICT, Scope.REPO, FailOn.ERROR, DEFAULT_MAX_FINDINGS,
                allChecks(Severity.ERROR));
    }

    private static Map<String, CheckPolicy> allChecks(Severity severity) {
        Map<String, CheckPolicy> m = new LinkedHashMap<>();
        for (String id : CheckIds.ALL_CHECKS) {
            m.put(id, CheckPolicy.enabled(severity));
        }
        return m;
    }
}
