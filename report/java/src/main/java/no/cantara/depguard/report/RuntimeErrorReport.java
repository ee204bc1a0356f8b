package no.cantara.depguard.report;

import no.cantara.depguard.check.CheckIds;
import no.cantara.depguard.engine.ScanData;
import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Fingerprints;
import no.cantara.depguard.finding.Verdict;
import no.cantara.depguard.policy.Scope;
import no.cantara.depguard.policy.Severity;

import java.time.Instant;
import java.util.List;

/**
 * The report written when a run cannot complete, so consumers always find a
 * well-formed envelope. Carries a single error finding and a failing verdict.
 */
public final class RuntimeErrorReport {

    static final String UNKNOWN_PROFILE = "unknown";
    static final String HELP = "Fix the tool error and re-run depguard.";

    private RuntimeErrorReport() {}

    public static ReportEnvelope of(String message, ToolMeta tool, Instant at) {
        return of(message, Scope.REPO.token(), UNKNOWN_PROFILE, tool, at);
    }

    public static ReportEnvelope of(String message, String scope, String profile, ToolMeta tool, Instant at) {
        Finding finding = Finding.builder(Severity.ERROR, CheckIds.TOOL_RUNTIME, CheckIds.CODE_RUNTIME_ERROR)
                .message(message != null ? message : "unknown error")
                .help(HELP)
                .fingerprint(fingerprint())
                .build();
        ScanData data = new ScanData(scope, profile, 0, 0, 1, 1, null);
        return new ReportEnvelope(ReportEnvelope.SCHEMA, tool, at, at, Verdict.FAIL, List.of(finding), data);
    }

    /** Independent of the message, so repeated failures of a run deduplicate. */
    static String fingerprint() {
        return Fingerprints.forWorkspace(CheckIds.TOOL_RUNTIME, CheckIds.CODE_RUNTIME_ERROR, ToolMeta.NAME);
    }
}
