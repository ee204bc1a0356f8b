package no.cantara.depguard.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw, unvalidated configuration as written by the user (schema {@code depguard.config.v1}).
 *
 * <p>Every field is optional; {@link ConfigResolver} validates and fills in defaults.
 */
public record DepguardConfig(
        String schema,
        String profile,
        String scope,
        String failOn,
        Integer maxFindings,
        Map<String, CheckConfig> checks
) {
    public DepguardConfig {
        checks = checks != null ? Collections.unmodifiableMap(new LinkedHashMap<>(checks)) : Map.of();
    }

    public static DepguardConfig empty() {
        return new DepguardConfig(null, null, null, null, null, Map.of());
    }
}
