package no.cantara.depguard.check;

/** Thrown when an allowlist pattern is not a valid glob. */
public class GlobSyntaxException extends IllegalArgumentException {

    private final String pattern;

    public GlobSyntaxException(String pattern, String reason) {
        super("invalid glob '" + pattern + "': " + reason);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
