package no.cantara.depguard.config;

/**
 * Caller-supplied settings that win over the configuration file. Per-check settings
 * come only from the file.
 */
public record Overrides(String profile, String scope, Integer maxFindings) {

    public static Overrides none() {
        return new Overrides(null, null, null);
    }
}
