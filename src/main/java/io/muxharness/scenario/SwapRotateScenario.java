package io.muxharness.scenario;

import io.muxharness.process.Outcome;

import java.util.ArrayList;
import java.util.List;

final class SwapRotateScenario extends SingleSessionScenario {
    private static final int ROTATIONS = 5;

    SwapRotateScenario() {
        super("swap-rotate", "SWAP AND ROTATE TESTS", "swap_test");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        ctx.mux("split-window", "-v", "-t", session);
        ctx.mux("split-window", "-h", "-t", session);
        ctx.stepPause();

        ctx.test("Swap pane up/down");
        List<Outcome> swaps = List.of(
                ctx.mux("swap-pane", "-U", "-t", session),
                ctx.mux("swap-pane", "-D", "-t", session)
        );
        ctx.expectSuccess(swaps, "Swap operations completed", "swap-pane failed");

        ctx.test("Rotate window");
        List<Outcome> rotations = new ArrayList<>();
        for (int i = 0; i < ROTATIONS; i++) {
            rotations.add(ctx.mux("rotate-window", "-t", session));
            ctx.burstPause();
        }
        ctx.expectSuccess(rotations, ROTATIONS + " rotations completed", "rotate-window failed");
    }
}
