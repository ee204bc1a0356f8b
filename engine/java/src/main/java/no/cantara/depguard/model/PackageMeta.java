package no.cantara.depguard.model;

/**
 * The {@code [package]} table of a manifest.
 */
public record PackageMeta(String name, boolean publish) {

    public static PackageMeta publishable(String name) {
        return new PackageMeta(name, true);
    }
}
