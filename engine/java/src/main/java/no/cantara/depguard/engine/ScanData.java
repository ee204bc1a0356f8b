package no.cantara.depguard.engine;

/**
 * Summary statistics of one evaluation.
 *
 * @param findingsTotal   findings produced before truncation
 * @param findingsEmitted findings kept in the report
 * @param truncatedReason set only when findings were dropped
 */
public record ScanData(
        String scope,
        String profile,
        int manifestsScanned,
        int dependenciesScanned,
        int findingsTotal,
        int findingsEmitted,
        String truncatedReason
) {
    public boolean truncated() {
        return truncatedReason != null;
    }
}
