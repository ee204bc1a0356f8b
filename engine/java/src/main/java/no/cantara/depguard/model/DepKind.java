package no.cantara.depguard.model;

/**
 * Lifecycle category of a declared dependency.
 */
public enum DepKind {
    NORMAL("dependencies"),
    DEV("dev-dependencies"),
    BUILD("build-dependencies");

    private final String sectionName;

    DepKind(String sectionName) {
        this.sectionName = sectionName;
    }

    /** The manifest section the dependency is declared under. */
    public String sectionName() {
        return sectionName;
    }

    public static DepKind fromSection(String section) {
        for (DepKind kind : values()) {
            if (kind.sectionName.equals(section) || kind.name().equalsIgnoreCase(section)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown dependency kind: " + section);
    }
}
