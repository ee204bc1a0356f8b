package no.cantara.depguard.model;

import java.util.Objects;

/**
 * One dependency edge declared by a manifest.
 *
 * @param target conditional-compilation qualifier (e.g. {@code cfg(unix)}), or {@code null};
 *               carried into findings for context only
 */
public record DependencyDecl(
        DepKind kind,
        String name,
        DepSpec spec,
        Location location,
        String target
) {
    public DependencyDecl {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        spec = spec != null ? spec : DepSpec.builder().build();
    }

    public static DependencyDecl normal(String name, DepSpec spec) {
        return new DependencyDecl(DepKind.NORMAL, name, spec, null, null);
    }
}
