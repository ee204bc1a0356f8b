package no.cantara.depguard.report;

import no.cantara.depguard.engine.DomainReport;
import no.cantara.depguard.engine.ScanData;
import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Verdict;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The versioned, machine-readable outer shape of a depguard run.
 */
public record ReportEnvelope(
        String schema,
        ToolMeta tool,
        Instant startedAt,
        Instant finishedAt,
        Verdict verdict,
        List<Finding> findings,
        ScanData data
) {
    public static final String SCHEMA = "depguard.report.v1";

    public ReportEnvelope {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(verdict, "verdict");
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    public static ReportEnvelope of(DomainReport report, ToolMeta tool, Instant startedAt, Instant finishedAt) {
        return new ReportEnvelope(SCHEMA, tool, startedAt, finishedAt,
                report.verdict(), report.findings(), report.data());
    }
}
