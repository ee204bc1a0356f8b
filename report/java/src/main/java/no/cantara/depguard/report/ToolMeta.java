package no.cantara.depguard.report;

/**
 * Name and version of the tool that produced a report.
 */
public record ToolMeta(String name, String version) {

    public static final String NAME = "depguard";

    /** Fallback when the jar manifest carries no implementation version. */
    static final String DEV_VERSION = "0.1.0-SNAPSHOT";

    public static ToolMeta current() {
        String version = ToolMeta.class.getPackage().getImplementationVersion();
        return new ToolMeta(NAME, version != null ? version : DEV_VERSION);
    }
}
