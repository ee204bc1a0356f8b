package no.cantara.depguard.report;

import no.cantara.depguard.WorkspaceModelParser;
import no.cantara.depguard.check.CheckRegistry;
import no.cantara.depguard.config.ConfigResolver;
import no.cantara.depguard.config.DepguardConfig;
import no.cantara.depguard.config.DepguardConfigParser;
import no.cantara.depguard.config.Overrides;
import no.cantara.depguard.engine.DepguardEngine;
import no.cantara.depguard.engine.DomainReport;
import no.cantara.depguard.engine.ScopeFilter;
import no.cantara.depguard.model.WorkspaceModel;
import no.cantara.depguard.policy.EffectiveConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One depguard run: load configuration and workspace model, resolve policy, narrow
 * to the requested scope, evaluate, and wrap the result in a report envelope.
 *
 * <p>Configuration and model errors propagate unchanged; no partial report is built.
 */
public final class DepguardRunner {

    private static final Logger log = LoggerFactory.getLogger(DepguardRunner.class);

    /**
     * @param workspaceModel YAML description of the workspace
     * @param configFile     {@code depguard.yaml}, or {@code null} for built-in defaults
     * @param changedFiles   repo-relative paths for diff scope, or {@code null}
     */
    public record Request(
        Path workspaceModel,
        Path configFile,
        Overrides overrides,
        List<String> changedFiles
    ) {
        public Request {
            Objects.requireNonNull(workspaceModel, "workspaceModel");
            overrides    = overrides != null ? overrides : Overrides.none();
            changedFiles = changedFiles != null ? List.copyOf(changedFiles) : null;
        }
    }

    private final DepguardEngine engine;
    private final ToolMeta tool;
    private final Clock clock;

    public DepguardRunner(DepguardEngine engine, ToolMeta tool, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.tool   = Objects.requireNonNull(tool, "tool");
        this.clock  = Objects.requireNonNull(clock, "clock");
    }

    /** Sequential engine with the built-in checks and the system clock. */
    public static DepguardRunner defaults() {
        return new DepguardRunner(DepguardEngine.sequential(CheckRegistry.defaults()),
                ToolMeta.current(), Clock.systemUTC());
    }

    public ToolMeta tool() {
        return tool;
    }

    public Clock clock() {
        return clock;
    }

    public ReportEnvelope run(Request request) throws IOException {
        Instant startedAt = clock.instant();

        DepguardConfig raw = request.configFile() != null
                ? DepguardConfigParser.parse(request.configFile())
                : DepguardConfig.empty();
        EffectiveConfig config = ConfigResolver.resolve(raw, request.overrides());

        WorkspaceModel model = WorkspaceModelParser.parse(request.workspaceModel());
        WorkspaceModel scoped = ScopeFilter.apply(model, config.scope(), request.changedFiles());
        if (scoped.manifests().size() != model.manifests().size()) {
            log.info("Diff scope: {} of {} manifest(s) selected", scoped.manifests().size(), model.manifests().size());
        }

        DomainReport report = engine.run(scoped, config);
        log.info("Profile '{}': {} finding(s) emitted of {}, verdict {}",
                config.profile(), report.data().findingsEmitted(), report.data().findingsTotal(), report.verdict());
        if (report.data().truncated()) {
            log.warn("{}", report.data().truncatedReason());
        }

        return ReportEnvelope.of(report, tool, startedAt, clock.instant());
    }
}
