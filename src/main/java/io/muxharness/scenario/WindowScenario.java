package io.muxharness.scenario;

import io.muxharness.process.Outcome;

import java.util.ArrayList;
import java.util.List;

final class WindowScenario extends SingleSessionScenario {
    private static final int WINDOWS = 5;
    private static final int NAVIGATION_ROUNDS = 10;
    private static final int SELECTED_INDEXES = 3;

    WindowScenario() {
        super("windows", "WINDOW OPERATIONS TESTS", "window_test");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        ctx.test("Create " + WINDOWS + " windows");
        List<Outcome> created = new ArrayList<>();
        for (int i = 0; i < WINDOWS; i++) {
            created.add(ctx.mux("new-window", "-t", session));
            ctx.stepPause();
        }
        ctx.expectSuccess(created, WINDOWS + " windows created", "new-window failed");

        ctx.test("List windows");
        Outcome listed = ctx.mux("list-windows", "-t", session);
        ctx.ledger().check(listed.succeeded() && listed.hasOutput(),
                "list-windows returned data",
                "list-windows failed (" + ScenarioContext.describe(listed) + ")");

        ctx.test("Window navigation");
        List<Outcome> navigation = new ArrayList<>();
        for (int i = 0; i < NAVIGATION_ROUNDS; i++) {
            navigation.add(ctx.mux("next-window", "-t", session));
            navigation.add(ctx.mux("previous-window", "-t", session));
        }
        ctx.expectCompleted(navigation, "Window navigation completed", "Window navigation stalled");

        ctx.test("Select window by index");
        List<Outcome> selected = new ArrayList<>();
        for (int i = 0; i < SELECTED_INDEXES; i++) {
            selected.add(ctx.mux("select-window", "-t", session + ":" + i));
            ctx.burstPause();
        }
        ctx.expectCompleted(selected, "Window selection by index works", "Window selection stalled");
    }
}
