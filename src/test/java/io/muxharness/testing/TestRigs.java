package io.muxharness.testing;

import io.muxharness.concurrent.ConcurrencyHarness;
import io.muxharness.concurrent.QuorumRule;
import io.muxharness.config.HarnessSettings;
import io.muxharness.ledger.ConsoleReporter;
import io.muxharness.ledger.ResultLedger;
import io.muxharness.probe.StateProbe;
import io.muxharness.scenario.ScenarioContext;
import io.muxharness.session.SessionManager;
import io.muxharness.session.SessionRegistry;
import picocli.CommandLine.Help.Ansi;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/** Wires scenario plumbing around an {@link InMemoryMultiplexer} with every delay at zero. */
public final class TestRigs {
    private TestRigs() {
    }

    public static HarnessSettings fastSettings() {
        return HarnessSettings.defaults().withoutDelays();
    }

    public static Rig rig(InMemoryMultiplexer mux) {
        return rig(mux, fastSettings());
    }

    public static Rig rig(InMemoryMultiplexer mux, HarnessSettings settings) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleReporter reporter = new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), Ansi.OFF);
        ResultLedger ledger = new ResultLedger(reporter, null);
        SessionRegistry registry = new SessionRegistry();
        StateProbe probe = new StateProbe(mux, settings.commandTimeout());
        SessionManager sessions = new SessionManager(mux, probe, registry, settings);
        ConcurrencyHarness concurrency = new ConcurrencyHarness(
                settings.workerPoolSize(),
                new QuorumRule(settings.quorumTolerance())
        );
        ScenarioContext context = new ScenarioContext(mux, sessions, ledger, reporter, concurrency, settings);
        return new Rig(context, ledger, buffer);
    }

    public static final class Rig {
        private final ScenarioContext context;
        private final ResultLedger ledger;
        private final ByteArrayOutputStream console;

        private Rig(ScenarioContext context, ResultLedger ledger, ByteArrayOutputStream console) {
            this.context = context;
            this.ledger = ledger;
            this.console = console;
        }

        public ScenarioContext context() {
            return context;
        }

        public ResultLedger ledger() {
            return ledger;
        }

        public String console() {
            return console.toString(StandardCharsets.UTF_8);
        }
    }
}
