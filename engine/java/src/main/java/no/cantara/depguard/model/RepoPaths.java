package no.cantara.depguard.model;

/**
 * Canonical repo-relative paths: forward slashes, no leading {@code ./}, never empty.
 */
public final class RepoPaths {

    private RepoPaths() {}

    public static String normalize(String raw) {
        if (raw == null) return ".";
        String v = raw.replace('\\', '/');
        while (v.startsWith("./")) {
            v = v.substring(2);
        }
        return v.isEmpty() ? "." : v;
    }
}
