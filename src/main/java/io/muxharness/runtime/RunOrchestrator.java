package io.muxharness.runtime;

import io.muxharness.concurrent.ConcurrencyHarness;
import io.muxharness.concurrent.QuorumRule;
import io.muxharness.config.HarnessConfig;
import io.muxharness.config.HarnessSettings;
import io.muxharness.ledger.ConsoleReporter;
import io.muxharness.ledger.LedgerSnapshot;
import io.muxharness.ledger.ResultLedger;
import io.muxharness.ledger.RunJournal;
import io.muxharness.probe.StateProbe;
import io.muxharness.process.Invocation;
import io.muxharness.process.Outcome;
import io.muxharness.process.TargetRunner;
import io.muxharness.process.TargetSpawnException;
import io.muxharness.scenario.Scenario;
import io.muxharness.scenario.ScenarioContext;
import io.muxharness.session.SessionManager;
import io.muxharness.session.SessionRegistry;
import io.muxharness.util.Pauses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs scenarios in order, then sweeps every session name the run could have created
 * and turns the ledger into a report and an exit status. A failing or throwing
 * scenario never stops the sequence, and the sweep runs whatever happened before it.
 */
public final class RunOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    private final HarnessConfig config;
    private final TargetRunner runner;
    private final ConsoleReporter reporter;
    private final ResultLedger ledger;
    private final SessionRegistry registry;
    private final SessionManager sessions;
    private final ScenarioContext context;
    private final String runId;

    public RunOrchestrator(HarnessConfig config, TargetRunner runner, ConsoleReporter reporter, RunJournal journal, String runId) {
        this.config = config;
        this.runner = runner;
        this.reporter = reporter;
        this.runId = runId == null || runId.isBlank() ? UUID.randomUUID().toString() : runId;
        HarnessSettings settings = config.settings();
        this.ledger = new ResultLedger(reporter, journal);
        this.registry = new SessionRegistry();
        StateProbe probe = new StateProbe(runner, settings.commandTimeout());
        this.sessions = new SessionManager(runner, probe, registry, settings);
        ConcurrencyHarness concurrency = new ConcurrencyHarness(
                settings.workerPoolSize(),
                new QuorumRule(settings.quorumTolerance())
        );
        this.context = new ScenarioContext(runner, sessions, ledger, reporter, concurrency, settings);
    }

    /**
     * Asks the target for its version. A target that cannot be launched is fatal.
     *
     * @throws TargetSpawnException when the binary cannot be started
     */
    public String preflight() {
        Outcome outcome = runner.run(Invocation.of(config.settings().commandTimeout(), "--version"));
        return outcome.stdout().strip();
    }

    public RunReport run(List<Scenario> scenarios) {
        Instant startedAt = Instant.now();
        reporter.banner("MUX HARNESS BATTLE SUITE", "Feature and concurrency checks over the command-line protocol");
        reporter.info("Binary: " + config.binaryLabel());
        reporter.info("Started: " + startedAt);
        String version = preflight();
        if (!version.isEmpty()) {
            reporter.info("Target version: " + version);
        }
        log.info("run {} started with {} scenarios against {}", runId, scenarios.size(), config.binaryLabel());

        List<String> ids = new ArrayList<>(scenarios.size());
        CleanupOutcome sweep;
        try {
            for (Scenario scenario : scenarios) {
                ids.add(scenario.id());
                runScenario(scenario);
            }
        } finally {
            sweep = sweep();
        }

        LedgerSnapshot snapshot = ledger.snapshot();
        Instant finishedAt = Instant.now();
        reporter.banner("FINAL RESULTS");
        reporter.summary(snapshot);
        reporter.info("Completed: " + finishedAt);
        int exitCode = snapshot.clean() ? 0 : 1;
        log.info("run {} finished: passed={} failed={} skipped={} exit={}",
                runId, snapshot.passed(), snapshot.failed(), snapshot.skipped(), exitCode);
        return new RunReport(
                runId,
                config.binaryLabel(),
                version,
                startedAt,
                finishedAt,
                Duration.between(startedAt, finishedAt).toMillis(),
                List.copyOf(ids),
                snapshot.passed(),
                snapshot.failed(),
                snapshot.skipped(),
                snapshot.total(),
                snapshot.passRate(),
                exitCode,
                sweep.swept(),
                sweep.leaked(),
                ledger.entries()
        );
    }

    private void runScenario(Scenario scenario) {
        HarnessSettings settings = config.settings();
        registry.registerAll(scenario.sessionNames(settings));
        reporter.section(scenario.title());
        ledger.beginScenario(scenario.id());
        try {
            scenario.run(context);
        } catch (TargetSpawnException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("scenario {} aborted", scenario.id(), e);
            ledger.recordFail("Scenario '" + scenario.id() + "' aborted: " + e.getMessage());
        }
    }

    /** Sweeps the given names without running any scenario. */
    public CleanupOutcome cleanup(List<String> names) {
        registry.registerAll(names);
        return sweep();
    }

    private CleanupOutcome sweep() {
        reporter.section("FINAL CLEANUP");
        ledger.beginScenario("cleanup");
        HarnessSettings settings = config.settings();
        List<String> swept = registry.drain();
        sessions.cleanupMany(swept);
        Pauses.sleep(settings.settleShortMs());

        List<String> leaked = new ArrayList<>();
        for (String name : swept) {
            try {
                if (!sessions.probe().awaitAbsent(name, settings.createProbeAttempts(), settings.probeIntervalMs())) {
                    leaked.add(name);
                }
            } catch (RuntimeException e) {
                log.warn("could not verify cleanup of session {}: {}", name, e.getMessage());
            }
        }
        if (!leaked.isEmpty()) {
            log.warn("sessions still present after cleanup: {}", leaked);
            reporter.info("Sessions still present after cleanup: " + String.join(", ", leaked));
        }
        reporter.info("Cleanup complete (" + swept.size() + " session names swept)");
        return new CleanupOutcome(swept, List.copyOf(leaked));
    }

    public ResultLedger ledger() {
        return ledger;
    }

    public SessionRegistry registry() {
        return registry;
    }

    public String runId() {
        return runId;
    }

    public record CleanupOutcome(List<String> swept, List<String> leaked) {
    }
}
