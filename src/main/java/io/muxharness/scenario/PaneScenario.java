package io.muxharness.scenario;

import io.muxharness.process.Outcome;

import java.util.ArrayList;
import java.util.List;

final class PaneScenario extends SingleSessionScenario {
    private static final int RAPID_SPLITS = 6;
    private static final int NAVIGATION_ROUNDS = 5;
    private static final String[] DIRECTIONS = {"-U", "-D", "-L", "-R"};

    PaneScenario() {
        super("panes", "PANE OPERATIONS TESTS", "pane_test");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        ctx.test("Vertical split");
        Outcome vertical = ctx.mux("split-window", "-v", "-t", session);
        ctx.stepPause();
        ctx.expectSuccess(List.of(vertical), "Vertical split created", "Vertical split failed");

        ctx.test("Horizontal split");
        Outcome horizontal = ctx.mux("split-window", "-h", "-t", session);
        ctx.stepPause();
        ctx.expectSuccess(List.of(horizontal), "Horizontal split created", "Horizontal split failed");

        // The target may refuse splits once panes get too small; only stalls count here.
        ctx.test("Multiple rapid splits");
        List<Outcome> splits = new ArrayList<>();
        for (int i = 0; i < RAPID_SPLITS; i++) {
            splits.add(ctx.mux("split-window", i % 2 == 0 ? "-v" : "-h", "-t", session));
            ctx.stepPause();
        }
        ctx.expectCompleted(splits, RAPID_SPLITS + " additional splits issued", "Rapid splits stalled");

        ctx.test("List panes");
        Outcome listed = ctx.mux("list-panes", "-t", session);
        ctx.ledger().check(listed.succeeded() && listed.hasOutput(),
                "list-panes returned data",
                "list-panes failed (" + ScenarioContext.describe(listed) + ")");

        ctx.test("Pane navigation all directions");
        List<Outcome> navigation = new ArrayList<>();
        for (int round = 0; round < NAVIGATION_ROUNDS; round++) {
            for (String direction : DIRECTIONS) {
                navigation.add(ctx.mux("select-pane", direction, "-t", session));
                ctx.burstPause();
            }
        }
        ctx.expectCompleted(navigation, "Pane navigation completed", "Pane navigation stalled");
    }
}
