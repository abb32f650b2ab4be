package io.muxharness.cli;

import io.muxharness.config.HarnessConfig;
import io.muxharness.ledger.ConsoleReporter;
import io.muxharness.ledger.RunJournal;
import io.muxharness.process.ProcessTargetRunner;
import io.muxharness.process.TargetRunner;
import io.muxharness.process.TargetSpawnException;
import io.muxharness.runtime.RunOrchestrator;
import io.muxharness.runtime.RunReport;
import io.muxharness.scenario.Scenario;
import io.muxharness.scenario.ScenarioCatalog;
import io.muxharness.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
        name = "muxharness",
        mixinStandardHelpOptions = true,
        version = "muxharness 0.1.0",
        description = "Black-box conformance and stress harness for terminal multiplexer CLIs",
        subcommands = {
                MuxHarnessCommand.RunCommand.class,
                MuxHarnessCommand.ScenariosCommand.class,
                MuxHarnessCommand.SweepCommand.class
        }
)
public final class MuxHarnessCommand implements Runnable {
    static final String LOG_LEVEL_PROPERTY = "muxharness.log.level";

    @Option(names = {"--binary"}, description = "Target multiplexer binary",
            defaultValue = "${env:MUX_HARNESS_BINARY:-" + HarnessConfig.DEFAULT_BINARY + "}")
    String binary;

    @Option(names = {"--settings"}, description = "Optional JSON settings file (timeouts, delays, pool size, quorum)")
    String settings;

    @Option(names = {"--color"}, defaultValue = "AUTO", description = "Console colors: AUTO|ON|OFF")
    Ansi color;

    @Option(names = {"-v", "--verbose"}, defaultValue = "false", description = "Log every target invocation to stderr")
    boolean verbose;

    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private Function<HarnessConfig, TargetRunner> runnerFactory = cfg -> new ProcessTargetRunner(cfg.targetCommand());

    @Override
    public void run() {
        out.println("Use subcommands: run | scenarios | sweep");
    }

    MuxHarnessCommand withStreams(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        return this;
    }

    MuxHarnessCommand withRunnerFactory(Function<HarnessConfig, TargetRunner> runnerFactory) {
        this.runnerFactory = runnerFactory;
        return this;
    }

    HarnessConfig config() {
        // Logback reads the level on first use, so this must happen before any logger is touched.
        if (verbose) {
            System.setProperty(LOG_LEVEL_PROPERTY, "DEBUG");
        }
        return HarnessConfig.forBinary(binary, settings);
    }

    ConsoleReporter reporter() {
        return new ConsoleReporter(out, color);
    }

    @Command(name = "run", description = "Run the scenario suite against the target")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        MuxHarnessCommand parent;

        @Option(names = {"--only"}, description = "Comma-separated scenario ids to run (default: all)")
        String only;

        @Option(names = {"--report-out"}, description = "Optional output JSON report path")
        String reportOut;

        @Option(names = {"--journal"}, description = "Optional NDJSON file receiving one line per check")
        String journal;

        @Override
        public Integer call() {
            List<Scenario> scenarios;
            HarnessConfig config;
            try {
                scenarios = ScenarioCatalog.select(only);
                config = parent.config();
            } catch (IllegalArgumentException | IllegalStateException e) {
                parent.err.println("error: " + e.getMessage());
                return 2;
            }
            String runId = UUID.randomUUID().toString();
            RunJournal runJournal = journal == null || journal.isBlank()
                    ? null
                    : new RunJournal(Path.of(journal), runId);
            RunOrchestrator orchestrator = new RunOrchestrator(
                    config,
                    parent.runnerFactory.apply(config),
                    parent.reporter(),
                    runJournal,
                    runId
            );
            RunReport report;
            try {
                report = orchestrator.run(scenarios);
            } catch (TargetSpawnException e) {
                parent.err.println("error: " + e.getMessage());
                return 2;
            }
            if (reportOut != null && !reportOut.isBlank()) {
                Jsons.writeFile(Path.of(reportOut), report);
            }
            return report.exitCode();
        }
    }

    @Command(name = "scenarios", description = "List scenario ids, titles and the session names they use")
    static final class ScenariosCommand implements Callable<Integer> {
        @ParentCommand
        MuxHarnessCommand parent;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print as JSON")
        boolean json;

        @Override
        public Integer call() {
            HarnessConfig config;
            try {
                config = parent.config();
            } catch (IllegalStateException e) {
                parent.err.println("error: " + e.getMessage());
                return 2;
            }
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Scenario scenario : ScenarioCatalog.defaults()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("id", scenario.id());
                row.put("title", scenario.title());
                row.put("sessions", scenario.sessionNames(config.settings()));
                rows.add(row);
            }
            if (json) {
                parent.out.println(Jsons.toJson(rows));
                return 0;
            }
            for (Map<String, Object> row : rows) {
                parent.out.printf("%-20s %s%n", row.get("id"), row.get("title"));
            }
            return 0;
        }
    }

    @Command(name = "sweep", description = "Kill every session name the suite may create (leftovers of aborted runs)")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        MuxHarnessCommand parent;

        @Override
        public Integer call() {
            HarnessConfig config;
            try {
                config = parent.config();
            } catch (IllegalStateException e) {
                parent.err.println("error: " + e.getMessage());
                return 2;
            }
            List<Scenario> all = ScenarioCatalog.defaults();
            RunOrchestrator orchestrator = new RunOrchestrator(
                    config,
                    parent.runnerFactory.apply(config),
                    parent.reporter(),
                    null,
                    null
            );
            RunOrchestrator.CleanupOutcome outcome;
            try {
                orchestrator.preflight();
                outcome = orchestrator.cleanup(ScenarioCatalog.declaredNames(all, config.settings()));
            } catch (TargetSpawnException e) {
                parent.err.println("error: " + e.getMessage());
                return 2;
            }
            parent.out.println(Jsons.toJson(outcome));
            return outcome.leaked().isEmpty() ? 0 : 1;
        }
    }
}
