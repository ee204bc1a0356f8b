package no.cantara.depguard.engine;

import no.cantara.depguard.check.Check;
import no.cantara.depguard.check.CheckRegistry;
import no.cantara.depguard.finding.Finding;
import no.cantara.depguard.finding.Verdict;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.EffectiveConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs every registered check and turns the findings into a {@link DomainReport}.
 *
 * <p>Findings are sorted with {@link FindingOrder}, counted, truncated to
 * {@code maxFindings}, and only then judged. A finding dropped by truncation does not
 * influence the verdict or the severity counts.
 *
 * <p>Evaluation is total: a valid model and config always yield a report.
 */
public final class DepguardEngine {

    private static final Logger log = LoggerFactory.getLogger(DepguardEngine.class);

    private final CheckRegistry registry;
    private final ExecutorService executor;

    private DepguardEngine(CheckRegistry registry, ExecutorService executor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = executor;
    }

    /** Runs the checks one after another on the calling thread. */
    public static DepguardEngine sequential(CheckRegistry registry) {
        return new DepguardEngine(registry, null);
    }

    /**
     * Runs each check as its own task on {@code executor}. The caller owns the executor.
     * Reports are identical to the sequential engine's.
     */
    public static DepguardEngine parallel(CheckRegistry registry, ExecutorService executor) {
        return new DepguardEngine(registry, Objects.requireNonNull(executor, "executor"));
    }

    /** Sequential evaluation with the built-in checks. */
    public static DomainReport evaluate(WorkspaceModel model, EffectiveConfig config) {
        return sequential(CheckRegistry.defaults()).run(model, config);
    }

    public DomainReport run(WorkspaceModel model, EffectiveConfig config) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(config, "config");

        List<Finding> findings = executor == null ? runSequential(model, config) : runParallel(model, config);
        findings.sort(FindingOrder.COMPARATOR);

        int total = findings.size();
        List<Finding> emitted = findings;
        String truncatedReason = null;
        if (total > config.maxFindings()) {
            emitted = findings.subList(0, config.maxFindings());
            truncatedReason = "findings truncated to max_findings=" + config.maxFindings();
            log.debug("Truncated {} findings to {}", total, config.maxFindings());
        }

        Verdict verdict = Verdicts.compute(emitted, config.failOn());
        SeverityCounts counts = SeverityCounts.of(emitted);
        ScanData data = new ScanData(
                config.scope().token(),
                config.profile(),
                model.manifests().size(),
                model.dependencyCount(),
                total,
                emitted.size(),
                truncatedReason);

        log.debug("Evaluated {} manifest(s), {} dependency declaration(s): {} finding(s), verdict {}",
                data.manifestsScanned(), data.dependenciesScanned(), total, verdict);
        return new DomainReport(verdict, emitted, data, counts);
    }

    private List<Finding> runSequential(WorkspaceModel model, EffectiveConfig config) {
        List<Finding> out = new ArrayList<>();
        for (Check check : registry.checks()) {
            int before = out.size();
            check.run(model, config, out);
            log.trace("Check {} produced {} finding(s)", check.id(), out.size() - before);
        }
        return out;
    }

    private List<Finding> runParallel(WorkspaceModel model, EffectiveConfig config) {
        List<CompletableFuture<List<Finding>>> futures = new ArrayList<>();
        for (Check check : registry.checks()) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                List<Finding> own = new ArrayList<>();
                check.run(model, config, own);
                return own;
            }, executor));
        }
        List<Finding> merged = new ArrayList<>();
        try {
            for (CompletableFuture<List<Finding>> future : futures) {
                merged.addAll(future.join());
            }
        } catch (CompletionException e) {
            // checks do not throw for valid input; anything here is a programming error
            throw new IllegalStateException("check execution failed", e.getCause());
        }
        return merged;
    }
}
