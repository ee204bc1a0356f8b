package no.cantara.depguard.engine;

import no.cantara.depguard.finding.Finding;

import java.util.Comparator;

/**
 * The total order of findings in a report.
 *
 * <p>Ascending by severity rank (errors first), location path, line, check id, code and
 * message. A finding without a location sorts after every located finding of the same
 * severity; a missing line sorts after every present line. Findings equal on all of these
 * fall back to fingerprint (missing last), then the {@code manifest} data entry, then the
 * rendered data map.
 */
public final class FindingOrder {

    /** Sorts after any repo-relative path. */
    static final String MISSING_PATH = "~";
    static final int MISSING_LINE = Integer.MAX_VALUE;

    public static final Comparator<Finding> COMPARATOR = Comparator
            .comparingInt((Finding f) -> f.severity().reportRank())
            .thenComparing(FindingOrder::pathKey)
            .thenComparingInt(FindingOrder::lineKey)
            .thenComparing(Finding::checkId)
            .thenComparing(Finding::code)
            .thenComparing(Finding::message)
            .thenComparing(Finding::fingerprint, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(FindingOrder::manifestKey)
            .thenComparing(f -> f.data().toString());

    private FindingOrder() {}

    private static String pathKey(Finding f) {
        return f.location() != null ? f.location().path() : MISSING_PATH;
    }

    private static String manifestKey(Finding f) {
        Object manifest = f.data().get("manifest");
        return manifest != null ? manifest.toString() : MISSING_PATH;
    }

    private static int lineKey(Finding f) {
        if (f.location() == null || f.location().line() == null) return MISSING_LINE;
        return f.location().line();
    }
}
