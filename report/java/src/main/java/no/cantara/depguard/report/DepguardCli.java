package no.cantara.depguard.report;

import no.cantara.depguard.config.Overrides;
import no.cantara.depguard.engine.SeverityCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CLI entry point for depguard.
 *
 * <pre>
 * Usage: depguard &lt;workspace.yaml&gt; [--config depguard.yaml] [--profile strict|warn|compat]
 *                 [--scope repo|diff] [--max-findings n] [--changed-file path]...
 *                 [--advisory] [--out report.json]
 *        depguard explain &lt;check-id|code&gt;
 * </pre>
 *
 * Without {@code --out} the JSON report goes to standard output. A run that cannot
 * complete still produces a report, holding a single {@code tool.runtime} finding.
 */
public class DepguardCli {

    private static final Logger log = LoggerFactory.getLogger(DepguardCli.class);

    static final String USAGE = """
            Usage: depguard <workspace.yaml> [--config depguard.yaml] [--profile strict|warn|compat]
                            [--scope repo|diff] [--max-findings n] [--changed-file path]...
                            [--advisory] [--out report.json]
                   depguard explain <check-id|code>""";

    private final DepguardRunner runner;

    public DepguardCli(DepguardRunner runner) {
        this.runner = runner;
    }

    public static void main(String[] args) {
        int code = new DepguardCli(DepguardRunner.defaults()).run(args, System.out, System.err);
        System.exit(code);
    }

    // ── Options ───────────────────────────────────────────────────────────────────

    record Options(
        Path workspace,
        Path config,
        String profile,
        String scope,
        Integer maxFindings,
        List<String> changedFiles,
        boolean advisory,
        Path out
    ) {}

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    static Options parseOptions(String[] args) throws UsageException {
        Path         workspace   = null;
        Path         config      = null;
        String       profile     = null;
        String       scope       = null;
        Integer      maxFindings = null;
        List<String> changed     = new ArrayList<>();
        boolean      advisory    = false;
        Path         out         = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config"       -> config  = Path.of(value(args, ++i, "--config"));
                case "--profile"      -> profile = value(args, ++i, "--profile");
                case "--scope"        -> scope   = value(args, ++i, "--scope");
                case "--changed-file" -> changed.add(value(args, ++i, "--changed-file"));
                case "--out"          -> out     = Path.of(value(args, ++i, "--out"));
                case "--advisory"     -> advisory = true;
                case "--max-findings" -> {
                    String raw = value(args, ++i, "--max-findings");
                    try {
                        maxFindings = Integer.parseInt(raw);
                    } catch (NumberFormatException e) {
                        throw new UsageException("--max-findings expects an integer, got '" + raw + "'");
                    }
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new UsageException("unknown option: " + args[i]);
                    }
                    if (workspace != null) {
                        throw new UsageException("more than one workspace model given");
                    }
                    workspace = Path.of(args[i]);
                }
            }
        }
        if (workspace == null) {
            throw new UsageException("missing workspace model");
        }
        // changed files imply diff scope unless a scope is given
        List<String> changedFiles = changed.isEmpty() ? null : changed;
        if (changedFiles != null && scope == null) {
            scope = "diff";
        }
        return new Options(workspace, config, profile, scope, maxFindings, changedFiles, advisory, out);
    }

    private static String value(String[] args, int index, String option) throws UsageException {
        if (index >= args.length) {
            throw new UsageException(option + " requires a value");
        }
        return args[index];
    }

    // ── Commands ──────────────────────────────────────────────────────────────────

    /** Runs the command line and returns the process exit code. */
    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println(USAGE);
            return ExitCodes.TOOL_ERROR;
        }
        if (args[0].equals("explain")) {
            return explain(args, out, err);
        }

        Options options;
        try {
            options = parseOptions(args);
        } catch (UsageException e) {
            err.println("depguard: " + e.getMessage());
            err.println(USAGE);
            return ExitCodes.TOOL_ERROR;
        }
        return check(options, out, err);
    }

    private int explain(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 2) {
            err.println(USAGE);
            return ExitCodes.TOOL_ERROR;
        }
        Optional<Explanation> explanation = Explanations.lookup(args[1]);
        if (explanation.isEmpty()) {
            err.println("depguard: unknown check id or code: " + args[1]);
            err.println("Check ids: " + String.join(", ", Explanations.allCheckIds()));
            err.println("Codes: " + String.join(", ", Explanations.allCodes()));
            return ExitCodes.TOOL_ERROR;
        }
        out.print(Explanations.format(args[1], explanation.get()));
        return ExitCodes.OK;
    }

    private int check(Options options, PrintStream out, PrintStream err) {
        ReportEnvelope report;
        int code;
        try {
            report = runner.run(new DepguardRunner.Request(
                    options.workspace(),
                    options.config(),
                    new Overrides(options.profile(), options.scope(), options.maxFindings()),
                    options.changedFiles()));
            code = ExitCodes.forVerdict(report.verdict(), options.advisory());
        } catch (Exception e) {
            log.error("Run failed: {}", e.getMessage());
            log.debug("Run failure", e);
            report = RuntimeErrorReport.of(String.valueOf(e.getMessage()), runner.tool(), runner.clock().instant());
            code = options.advisory() ? ExitCodes.OK : ExitCodes.TOOL_ERROR;
        }

        try {
            if (options.out() != null) {
                ReportWriter.write(report, options.out());
                out.println(summary(report) + ", report written to " + options.out());
            } else {
                ReportWriter.write(report, out);
                out.println();
                err.println(summary(report));
            }
        } catch (IOException e) {
            err.println("depguard: failed to write report: " + e.getMessage());
            return ExitCodes.TOOL_ERROR;
        }
        return code;
    }

    static String summary(ReportEnvelope report) {
        SeverityCounts counts = SeverityCounts.of(report.findings());
        return String.format("depguard: %s, %d finding(s) (%d error, %d warning, %d info)",
                report.verdict().name(), report.findings().size(),
                counts.error(), counts.warning(), counts.info());
    }
}
