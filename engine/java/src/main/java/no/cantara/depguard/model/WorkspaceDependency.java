package no.cantara.depguard.model;

/**
 * One entry of the shared workspace-level dependency table.
 */
public record WorkspaceDependency(
        String name,
        String version,
        String path,
        boolean workspace
) {}
