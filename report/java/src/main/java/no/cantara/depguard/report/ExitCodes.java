package no.cantara.depguard.report;

import no.cantara.depguard.finding.Verdict;

/**
 * Process exit codes of the command line.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int WARN = 1;
    public static final int TOOL_ERROR = 1;
    public static final int FAIL = 2;

    private ExitCodes() {}

    /**
     * PASS→0, WARN→1, FAIL→2. An advisory run always exits 0.
     */
    public static int forVerdict(Verdict verdict, boolean advisory) {
        if (advisory) return OK;
        return switch (verdict) {
            case PASS -> OK;
            case WARN -> WARN;
            case FAIL -> FAIL;
        };
    }
}
