package no.cantara.depguard.policy;

import java.util.List;
import java.util.Objects;

/**
 * Resolved configuration of one check.
 *
 * @param allow              glob patterns exempting matched values from reporting
 * @param ignorePublishFalse also enforce version checks on manifests with {@code publish = false}
 */
public record CheckPolicy(
        boolean enabled,
        Severity severity,
        List<String> allow,
        boolean ignorePublishFalse
) {
    public CheckPolicy {
        Objects.requireNonNull(severity, "severity");
        allow = allow != null ? List.copyOf(allow) : List.of();
    }

    public static CheckPolicy enabled(Severity severity) {
        return new CheckPolicy(true, severity, List.of(), false);
    }

    public static CheckPolicy disabled() {
        return new CheckPolicy(false, Severity.INFO, List.of(), false);
    }

    public CheckPolicy withEnabled(boolean value) {
        return new CheckPolicy(value, severity, allow, ignorePublishFalse);
    }

    public CheckPolicy withSeverity(Severity value) {
        return new CheckPolicy(enabled, value, allow, ignorePublishFalse);
    }

    public CheckPolicy withAllow(List<String> value) {
        return new CheckPolicy(enabled, severity, value, ignorePublishFalse);
    }

    public CheckPolicy withIgnorePublishFalse(boolean value) {
        return new CheckPolicy(enabled, severity, allow, value);
    }
}
