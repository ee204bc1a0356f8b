package no.cantara.depguard.finding;

import no.cantara.depguard.model.Location;
import no.cantara.depguard.policy.Severity;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One reported policy violation. Created by checks, read-only afterwards.
 *
 * @param fingerprint stable identity for cross-run deduplication, independent of message wording
 * @param data        check-specific context, key-ordered
 */
public record Finding(
        Severity severity,
        String checkId,
        String code,
        String message,
        Location location,
        String help,
        String url,
        String fingerprint,
        Map<String, Object> data
) {
    public Finding {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(checkId, "checkId");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        data = data != null ? Collections.unmodifiableMap(new TreeMap<>(data)) : Map.of();
    }

    public static Builder builder(Severity severity, String checkId, String code) {
        return new Builder(severity, checkId, code);
    }

    public static final class Builder {
        private final Severity severity;
        private final String checkId;
        private final String code;
        private String message;
        private Location location;
        private String help;
        private String url;
        private String fingerprint;
        private final Map<String, Object> data = new TreeMap<>();

        private Builder(Severity severity, String checkId, String code) {
            this.severity = severity;
            this.checkId = checkId;
            this.code = code;
        }

        public Builder message(String message) { this.message = message; return this; }
        public Builder location(Location location) { this.location = location; return this; }
        public Builder help(String help) { this.help = help; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder fingerprint(String fingerprint) { this.fingerprint = fingerprint; return this; }

        /** Adds a data entry; {@code null} values are skipped. */
        public Builder data(String key, Object value) {
            if (value != null) {
                data.put(key, value);
            }
            return this;
        }

        public Finding build() {
            return new Finding(severity, checkId, code, message, location, help, url, fingerprint, data);
        }
    }
}
