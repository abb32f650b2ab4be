package io.muxharness.scenario;

import io.muxharness.concurrent.ConcurrencyHarness;
import io.muxharness.config.HarnessSettings;
import io.muxharness.ledger.ConsoleReporter;
import io.muxharness.ledger.ResultLedger;
import io.muxharness.probe.StateProbe;
import io.muxharness.process.Invocation;
import io.muxharness.process.Outcome;
import io.muxharness.process.TargetRunner;
import io.muxharness.session.SessionManager;
import io.muxharness.util.Pauses;

import java.util.Collection;

/**
 * Everything a scenario needs to drive the target and report checks.
 */
public final class ScenarioContext {
    private static final int MAX_DETAIL_CHARS = 160;

    private final TargetRunner runner;
    private final SessionManager sessions;
    private final ResultLedger ledger;
    private final ConsoleReporter reporter;
    private final ConcurrencyHarness concurrency;
    private final HarnessSettings settings;

    public ScenarioContext(
            TargetRunner runner,
            SessionManager sessions,
            ResultLedger ledger,
            ConsoleReporter reporter,
            ConcurrencyHarness concurrency,
            HarnessSettings settings
    ) {
        this.runner = runner;
        this.sessions = sessions;
        this.ledger = ledger;
        this.reporter = reporter;
        this.concurrency = concurrency;
        this.settings = settings;
    }

    public Outcome mux(String... args) {
        return runner.run(Invocation.of(settings.commandTimeout(), args));
    }

    public String session(String suffix) {
        return settings.sessionPrefix() + suffix;
    }

    public void pause(long delayMs) {
        Pauses.sleep(delayMs);
    }

    public void stepPause() {
        Pauses.sleep(settings.stepDelayMs());
    }

    public void burstPause() {
        Pauses.sleep(settings.burstDelayMs());
    }

    public void test(String message) {
        reporter.test(message);
    }

    public void info(String message) {
        reporter.info(message);
    }

    /** Pass when every invocation completed with exit code 0. */
    public void expectSuccess(Collection<Outcome> outcomes, String passMessage, String failMessage) {
        for (Outcome outcome : outcomes) {
            if (!outcome.succeeded()) {
                ledger.recordFail(failMessage + " (" + describe(outcome) + ")");
                return;
            }
        }
        ledger.recordPass(passMessage);
    }

    /** Pass when no invocation timed out; exit codes are not judged. */
    public void expectCompleted(Collection<Outcome> outcomes, String passMessage, String failMessage) {
        long timedOut = outcomes.stream().filter(Outcome::timedOut).count();
        if (timedOut > 0L) {
            ledger.recordFail(failMessage + " (" + timedOut + "/" + outcomes.size() + " timed out)");
            return;
        }
        ledger.recordPass(passMessage);
    }

    public static String describe(Outcome outcome) {
        return outcome.asCompleted()
                .map(c -> {
                    String err = c.stderr().replace("\r", " ").replace("\n", " ").trim();
                    if (err.length() > MAX_DETAIL_CHARS) {
                        err = err.substring(0, MAX_DETAIL_CHARS) + "...";
                    }
                    return err.isEmpty() ? "exit=" + c.exitCode() : "exit=" + c.exitCode() + ": " + err;
                })
                .orElse("timed out after " + outcome.durationMs() + " ms");
    }

    public TargetRunner runner() {
        return runner;
    }

    public SessionManager sessions() {
        return sessions;
    }

    public StateProbe probe() {
        return sessions.probe();
    }

    public ResultLedger ledger() {
        return ledger;
    }

    public ConcurrencyHarness concurrency() {
        return concurrency;
    }

    public HarnessSettings settings() {
        return settings;
    }
}
