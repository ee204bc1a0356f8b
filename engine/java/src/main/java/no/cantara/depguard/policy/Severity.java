package no.cantara.depguard.policy;

import java.util.Locale;
import java.util.Optional;

/**
 * Finding severity, ordered {@code INFO < WARNING < ERROR}.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR;

    /** Sort rank used in reports: errors first. */
    public int reportRank() {
        return switch (this) {
            case ERROR -> 0;
            case WARNING -> 1;
            case INFO -> 2;
        };
    }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts {@code info}, {@code warning} (or {@code warn}) and {@code error}. */
    public static Optional<Severity> parse(String value) {
        if (value == null) return Optional.empty();
        return switch (value) {
            case "info" -> Optional.of(INFO);
            case "warning", "warn" -> Optional.of(WARNING);
            case "error" -> Optional.of(ERROR);
            default -> Optional.empty();
        };
    }
}
