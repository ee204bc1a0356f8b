package no.cantara.depguard.policy;

import java.util.Optional;

/**
 * Whether a run covers the whole workspace or only manifests touched by a change.
 */
public enum Scope {
    REPO("repo"),
    DIFF("diff");

    private final String token;

    Scope(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<Scope> parse(String value) {
        for (Scope scope : values()) {
            if (scope.token.equals(value)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
