package no.cantara.depguard.report;

/**
 * Human-readable guidance for a check id or finding code.
 */
public record Explanation(String title, String description, String remediation) {}
