package no.cantara.depguard.report;

import com.fasterxml.jackson.databind.JsonNode;
import no.cantara.depguard.check.CheckIds;
import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Fingerprints;
import no.cantara.depguard.finding.Verdict;
import no.cantara.depguard.policy.Severity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeErrorReportTest {

    @Test void singleErrorFindingAndFailVerdict() {
        ReportEnvelope report = RuntimeErrorReport.of("config: unknown scope: everywhere", Fixtures.TOOL, Fixtures.NOW);

        assertEquals(ReportEnvelope.SCHEMA, report.schema());
        assertEquals(Verdict.FAIL, report.verdict());
        assertEquals(1, report.findings().size());

        Finding f = report.findings().get(0);
        assertEquals(Severity.ERROR, f.severity());
        assertEquals(CheckIds.TOOL_RUNTIME, f.checkId());
        assertEquals(CheckIds.CODE_RUNTIME_ERROR, f.code());
        assertEquals("config: unknown scope: everywhere", f.message());
        assertNull(f.location());
        assertNotNull(f.help());
        assertEquals(RuntimeErrorReport.fingerprint(), f.fingerprint());
    }

    @Test void fingerprintIsStableAcrossMessages() throws Exception {
        Finding first = RuntimeErrorReport.of("boom", Fixtures.TOOL, Fixtures.NOW).findings().get(0);
        Finding second = RuntimeErrorReport.of("other failure", "diff", "warn", Fixtures.TOOL, Fixtures.NOW)
                .findings().get(0);

        assertNotNull(first.fingerprint());
        assertEquals(64, first.fingerprint().length());
        assertEquals(first.fingerprint(), second.fingerprint());
        assertEquals(Fingerprints.forWorkspace(CheckIds.TOOL_RUNTIME, CheckIds.CODE_RUNTIME_ERROR, "depguard"),
                first.fingerprint());

        JsonNode json = ReportWriter.mapper()
                .readTree(ReportWriter.toJson(RuntimeErrorReport.of("boom", Fixtures.TOOL, Fixtures.NOW)));
        assertEquals(first.fingerprint(), json.get("findings").get(0).get("fingerprint").asText());
    }

    @Test void scanDataDescribesAnEmptyRun() {
        ReportEnvelope report = RuntimeErrorReport.of("boom", "diff", "warn", Fixtures.TOOL, Fixtures.NOW);

        assertEquals("diff", report.data().scope());
        assertEquals("warn", report.data().profile());
        assertEquals(0, report.data().manifestsScanned());
        assertEquals(1, report.data().findingsTotal());
        assertEquals(1, report.data().findingsEmitted());
        assertEquals(report.startedAt(), report.finishedAt());
    }

    @Test void defaultsToRepoScopeAndUnknownProfile() throws Exception {
        JsonNode data = ReportWriter.mapper()
                .readTree(ReportWriter.toJson(RuntimeErrorReport.of("boom", Fixtures.TOOL, Fixtures.NOW)))
                .get("data");
        assertEquals("repo", data.get("scope").asText());
        assertEquals("unknown", data.get("profile").asText());
    }

    @Test void nullMessageIsReplaced() {
        assertFalse(RuntimeErrorReport.of(null, Fixtures.TOOL, Fixtures.NOW).findings().get(0).message().isEmpty());
    }
}
