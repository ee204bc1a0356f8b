package no.cantara.depguard.check;

import java.util.List;

/**
 * A set of glob patterns exempting matched values from a check.
 */
public final class Allowlist {

    private static final Allowlist EMPTY = new Allowlist(List.of());

    private final List<Glob> globs;

    private Allowlist(List<Glob> globs) {
        this.globs = globs;
    }

    /**
     * Compiles every pattern.
     *
     * @throws GlobSyntaxException if a pattern is invalid
     */
    public static Allowlist of(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return EMPTY;
        }
        return new Allowlist(patterns.stream().map(Glob::compile).toList());
    }

    public boolean isAllowed(String value) {
        return globs.stream().anyMatch(g -> g.matches(value));
    }

    public boolean isEmpty() {
        return globs.isEmpty();
    }
}
