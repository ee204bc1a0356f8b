package no.cantara.depguard.policy;

import java.util.Optional;

/**
 * The lowest severity that turns the verdict into a failure.
 */
public enum FailOn {
    ERROR,
    WARNING;

    public static Optional<FailOn> parse(String value) {
        if (value == null) return Optional.empty();
        return switch (value) {
            case "error" -> Optional.of(ERROR);
            case "warning", "warn" -> Optional.of(WARNING);
            default -> Optional.empty();
        };
    }
}
