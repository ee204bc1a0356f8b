package no.cantara.depguard.engine;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Verdict;
import no.cantara.depguard.policy.FailOn;
import no.cantara.depguard.policy.Severity;

import java.util.List;

/**
 * Verdict over the emitted findings.
 */
public final class Verdicts {

    private Verdicts() {}

    public static Verdict compute(List<Finding> findings, FailOn failOn) {
        if (findings.stream().anyMatch(f -> f.severity() == Severity.ERROR)) {
            return Verdict.FAIL;
        }
        if (findings.stream().anyMatch(f -> f.severity() == Severity.WARNING)) {
            return failOn == FailOn.WARNING ? Verdict.FAIL : Verdict.WARN;
        }
        return Verdict.PASS;
    }
}
