package no.cantara.depguard.config;

/**
 * Invalid configuration. The message names the offending field or check.
 */
public class ConfigException extends RuntimeException {

    public enum Kind {
        PARSE,
        INVALID_SCOPE,
        INVALID_SEVERITY,
        INVALID_FAIL_ON,
        INVALID_GLOB,
        INVALID_MAX_FINDINGS
    }

    private final Kind kind;
    private final String subject;

    public ConfigException(Kind kind, String subject, String message) {
        super(message);
        this.kind = kind;
        this.subject = subject;
    }

    public ConfigException(Kind kind, String subject, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.subject = subject;
    }

    public Kind kind() {
        return kind;
    }

    /** The field or check id the error is about. */
    public String subject() {
        return subject;
    }
}
