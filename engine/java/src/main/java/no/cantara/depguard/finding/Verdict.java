package no.cantara.depguard.finding;

/**
 * Overall outcome of a run.
 */
public enum Verdict {
    PASS,
    WARN,
    FAIL
}
