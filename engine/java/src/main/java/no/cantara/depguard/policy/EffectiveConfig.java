package no.cantara.depguard.policy;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fully resolved policy for one evaluation run.
 *
 * @param checks check id to its policy; ids with no registered check are tolerated
 */
public record EffectiveConfig(
        String profile,
        Scope scope,
        FailOn failOn,
        int maxFindings,
        Map<String, CheckPolicy> checks
) {
    public EffectiveConfig {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(failOn, "failOn");
        if (maxFindings < 0) {
            throw new IllegalArgumentException("maxFindings must not be negative: " + maxFindings);
        }
        checks = checks != null ? Collections.unmodifiableMap(new TreeMap<>(checks)) : Map.of();
    }

    /** The policy for {@code checkId}, present only when configured and enabled. */
    public Optional<CheckPolicy> checkPolicy(String checkId) {
        return Optional.ofNullable(checks.get(checkId)).filter(CheckPolicy::enabled);
    }

    public EffectiveConfig withScope(Scope value) {
        return new EffectiveConfig(profile, value, failOn, maxFindings, checks);
    }

    public EffectiveConfig withFailOn(FailOn value) {
        return new EffectiveConfig(profile, scope, value, maxFindings, checks);
    }

    public EffectiveConfig withMaxFindings(int value) {
        return new EffectiveConfig(profile, scope, failOn, value, checks);
    }

    public EffectiveConfig withChecks(Map<String, CheckPolicy> value) {
        return new EffectiveConfig(profile, scope, failOn, maxFindings, value);
    }
}
