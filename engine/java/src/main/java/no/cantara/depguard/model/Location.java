package no.cantara.depguard.model;

/**
 * A position inside a manifest file. Used for reporting only, never for identity.
 *
 * @param path repo-relative path of the file
 * @param line 1-based line, or {@code null} when unknown
 * @param col  1-based column, or {@code null} when unknown
 */
public record Location(String path, Integer line, Integer col) {
    public Location {
        path = RepoPaths.normalize(path);
    }

    public static Location of(String path, int line) {
        return new Location(path, line, null);
    }
}
