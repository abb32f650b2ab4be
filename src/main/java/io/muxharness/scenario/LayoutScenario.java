package io.muxharness.scenario;

import io.muxharness.process.Outcome;

import java.util.List;

final class LayoutScenario extends SingleSessionScenario {
    static final List<String> LAYOUTS = List.of(
            "even-horizontal",
            "even-vertical",
            "main-horizontal",
            "main-vertical",
            "tiled"
    );

    LayoutScenario() {
        super("layouts", "LAYOUT TESTS", "layout_test");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        prepareSplits(ctx, session, 3);
        for (String layout : LAYOUTS) {
            ctx.test("Apply layout: " + layout);
            Outcome applied = ctx.mux("select-layout", "-t", session, layout);
            ctx.stepPause();
            ctx.expectSuccess(List.of(applied), layout + " applied", layout + " rejected");
        }
    }
}
