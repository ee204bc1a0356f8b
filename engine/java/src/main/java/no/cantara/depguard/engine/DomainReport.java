package no.cantara.depguard.engine;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Verdict;

import java.util.List;

/**
 * Result of one evaluation: the verdict, the sorted and bounded findings, and counts.
 */
public record DomainReport(
        Verdict verdict,
        List<Finding> findings,
        ScanData data,
        SeverityCounts counts
) {
    public DomainReport {
        findings = findings != null ? List.copyOf(findings) : List.of();
    }
}
