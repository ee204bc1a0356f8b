package no.cantara.depguard.config;

import java.util.List;

/**
 * User-supplied settings for one check. {@code null} fields leave the preset untouched.
 *
 * @param allow glob patterns; an empty list keeps the preset's allowlist
 */
public record CheckConfig(
        Boolean enabled,
        String severity,
        List<String> allow,
        Boolean ignorePublishFalse
) {
    public CheckConfig {
        allow = allow != null ? List.copyOf(allow) : List.of();
    }

    public static CheckConfig empty() {
        return new CheckConfig(null, null, List.of(), null);
    }
}
