package io.muxharness.scenario;

import io.muxharness.config.HarnessSettings;
import io.muxharness.process.Outcome;

import java.util.List;

/**
 * Pane lifecycle on a fixed session name plus a strict error-path check, both judged
 * only by exit codes and output presence.
 */
final class EndToEndScenario implements Scenario {
    static final String SESSION = "e2e1";
    static final String MISSING_SESSION = "does_not_exist_42";

    @Override
    public String id() {
        return "end-to-end";
    }

    @Override
    public String title() {
        return "END-TO-END TESTS";
    }

    @Override
    public List<String> sessionNames(HarnessSettings settings) {
        return List.of(SESSION);
    }

    @Override
    public void run(ScenarioContext ctx) {
        try {
            paneLifecycle(ctx);
        } finally {
            ctx.sessions().kill(SESSION);
        }
        errorPath(ctx);
    }

    private void paneLifecycle(ScenarioContext ctx) {
        ctx.test("Split, list and destroy '" + SESSION + "'");
        if (!ctx.sessions().create(SESSION)) {
            ctx.ledger().recordFail("Could not create session '" + SESSION + "'");
            return;
        }
        List<Outcome> splits = List.of(
                ctx.mux("split-window", "-v", "-t", SESSION),
                ctx.mux("split-window", "-v", "-t", SESSION)
        );
        ctx.expectSuccess(splits, "Two vertical splits created", "split-window failed");

        Outcome panes = ctx.mux("list-panes", "-t", SESSION);
        ctx.ledger().check(panes.hasOutput(), "list-panes listed the panes", "list-panes returned nothing");

        // The exit code of kill-session itself is not judged; only has-session decides.
        Outcome killed = ctx.mux("kill-session", "-t", SESSION);
        ctx.pause(ctx.settings().settleShortMs());
        HarnessSettings settings = ctx.settings();
        boolean gone = ctx.probe().awaitAbsent(SESSION, settings.createProbeAttempts(), settings.probeIntervalMs());
        ctx.ledger().check(gone,
                "has-session reports '" + SESSION + "' gone",
                "'" + SESSION + "' survived kill-session (" + ScenarioContext.describe(killed) + ")");
    }

    private void errorPath(ScenarioContext ctx) {
        ctx.test("split-window on '" + MISSING_SESSION + "'");
        Outcome outcome = ctx.mux("split-window", "-t", MISSING_SESSION);
        ctx.ledger().check(outcome.signalsError(),
                "Missing session rejected",
                "Missing session not rejected (" + ScenarioContext.describe(outcome) + ")");
    }
}
