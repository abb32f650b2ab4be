package io.muxharness.scenario;

import io.muxharness.process.Outcome;

import java.util.ArrayList;
import java.util.List;

final class ResizeScenario extends SingleSessionScenario {
    private static final int STEPS_PER_DIRECTION = 5;
    private static final String RESIZE_AMOUNT = "3";

    ResizeScenario() {
        super("resize", "RESIZE OPERATIONS TESTS", "resize_test");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        ctx.mux("split-window", "-v", "-t", session);
        ctx.mux("split-window", "-h", "-t", session);
        ctx.stepPause();

        for (Direction direction : Direction.values()) {
            ctx.test("Resize pane " + direction.label);
            List<Outcome> steps = new ArrayList<>();
            for (int i = 0; i < STEPS_PER_DIRECTION; i++) {
                steps.add(ctx.mux("resize-pane", direction.flag, RESIZE_AMOUNT, "-t", session));
                ctx.burstPause();
            }
            // A pane already at its edge may reject a resize; geometry is not asserted.
            ctx.expectCompleted(steps, "Resize " + direction.label + " completed", "Resize " + direction.label + " stalled");
        }

        ctx.test("Zoom pane toggle");
        List<Outcome> zoom = new ArrayList<>();
        zoom.add(ctx.mux("resize-pane", "-Z", "-t", session));
        ctx.stepPause();
        zoom.add(ctx.mux("resize-pane", "-Z", "-t", session));
        ctx.expectSuccess(zoom, "Zoom toggle completed", "Zoom toggle failed");
    }

    private enum Direction {
        UP("-U", "up"),
        DOWN("-D", "down"),
        LEFT("-L", "left"),
        RIGHT("-R", "right");

        private final String flag;
        private final String label;

        Direction(String flag, String label) {
            this.flag = flag;
            this.label = label;
        }
    }
}
