package io.muxharness.scenario;

import io.muxharness.config.HarnessSettings;
import io.muxharness.process.Outcome;

import java.util.ArrayList;
import java.util.List;

final class KillScenario extends SingleSessionScenario {
    KillScenario() {
        super("kill", "KILL OPERATIONS TESTS", "kill_test");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        ctx.test("Create and kill panes");
        prepareSplits(ctx, session, 3);
        Outcome killPane = ctx.mux("kill-pane", "-t", session);
        ctx.stepPause();
        ctx.expectSuccess(List.of(killPane), "Pane killed", "kill-pane failed");

        ctx.test("Create and kill windows");
        List<Outcome> windows = new ArrayList<>();
        windows.add(ctx.mux("new-window", "-t", session));
        windows.add(ctx.mux("new-window", "-t", session));
        ctx.stepPause();
        windows.add(ctx.mux("kill-window", "-t", session));
        ctx.stepPause();
        ctx.expectSuccess(windows, "Window killed", "Window create/kill failed");

        ctx.test("Kill session");
        ctx.sessions().kill(session);
        HarnessSettings settings = ctx.settings();
        ctx.ledger().check(
                ctx.probe().awaitAbsent(session, settings.createProbeAttempts(), settings.probeIntervalMs()),
                "Session killed",
                "Session still exists");
    }
}
