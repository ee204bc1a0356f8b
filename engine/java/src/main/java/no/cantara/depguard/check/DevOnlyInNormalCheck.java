package no.cantara.depguard.check;

import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Fingerprints;
import no.cantara.depguard.model.DepKind;
import no.cantara.depguard.model.DependencyDecl;
import no.cantara.depguard.model.ManifestModel;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.CheckPolicy;
import no.cantara.depguard.policy.EffectiveConfig;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Flags test, mocking and benchmarking packages declared as production dependencies.
 */
public final class DevOnlyInNormalCheck implements Check {

    static final Set<String> DEV_ONLY_PACKAGES = Set.of(
            // test frameworks
            "proptest", "quickcheck", "rstest", "test-case", "test-strategy",
            // mocking
            "mockall", "mockito", "wiremock", "httpmock",
            // snapshots
            "insta", "expect-test",
            // benchmarks
            "criterion", "divan", "iai",
            // test utilities
            "tempfile", "assert_cmd", "assert_fs", "predicates", "fake", "arbitrary",
            "cargo-llvm-cov");

    @Override
    public String id() {
        return CheckIds.DEPS_DEV_ONLY_IN_NORMAL;
    }

    @Override
    public void run(WorkspaceModel model, EffectiveConfig config, List<Finding> out) {
        Optional<CheckPolicy> policy = config.checkPolicy(id());
        if (policy.isEmpty()) return;
        Allowlist allow = Allowlist.of(policy.get().allow());

        for (ManifestModel manifest : model.manifests()) {
            for (DependencyDecl dep : manifest.dependencies()) {
                if (dep.kind() != DepKind.NORMAL || !DEV_ONLY_PACKAGES.contains(dep.name())) continue;
                if (allow.isAllowed(dep.name())) continue;

                out.add(FindingData.forDependency(id(), CheckIds.CODE_DEV_DEP_IN_NORMAL, policy.get(), manifest, dep)
                        .message("dependency '" + dep.name()
                                + "' is typically a dev-only crate but appears in [dependencies]")
                        .help("Move this dependency to [dev-dependencies] unless it's genuinely needed in production code.")
                        .fingerprint(Fingerprints.forDependency(id(), CheckIds.CODE_DEV_DEP_IN_NORMAL,
                                manifest.path(), dep.name(), null))
                        .data("current_spec", dep.spec().toData())
                        .data("fix_action", CheckIds.FIX_ACTION_MOVE_TO_DEV)
                        .data("fix_hint", "Move to [dev-dependencies]")
                        .build());
            }
        }
    }
}
