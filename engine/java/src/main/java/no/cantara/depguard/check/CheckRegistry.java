package no.cantara.depguard.check;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An ordered, immutable set of checks. Registration order is the execution order of the
 * sequential engine; it has no influence on the final order of findings.
 */
public final class CheckRegistry {

    private final List<Check> checks;

    private CheckRegistry(List<Check> checks) {
        this.checks = checks;
    }

    /** The built-in dependency checks. */
    public static CheckRegistry defaults() {
        return of(List.of(
                new NoWildcardsCheck(),
                new PathRequiresVersionCheck(),
                new PathSafetyCheck(),
                new WorkspaceInheritanceCheck(),
                new GitRequiresVersionCheck(),
                new DevOnlyInNormalCheck(),
                new DefaultFeaturesExplicitCheck(),
                new NoMultipleVersionsCheck(),
                new OptionalUnusedCheck()));
    }

    /**
     * @throws IllegalArgumentException if two checks share an id
     */
    public static CheckRegistry of(List<Check> checks) {
        Map<String, Check> byId = new LinkedHashMap<>();
        for (Check check : checks) {
            if (byId.putIfAbsent(check.id(), check) != null) {
                throw new IllegalArgumentException("duplicate check id: " + check.id());
            }
        }
        return new CheckRegistry(List.copyOf(checks));
    }

    public List<Check> checks() {
        return checks;
    }

    public Optional<Check> find(String id) {
        return checks.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    public List<String> ids() {
        return checks.stream().map(Check::id).toList();
    }
}
