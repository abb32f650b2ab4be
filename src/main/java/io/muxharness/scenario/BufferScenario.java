package io.muxharness.scenario;

import io.muxharness.process.Outcome;

import java.util.List;

final class BufferScenario extends SingleSessionScenario {
    static final String BUFFER_TEXT = "Test buffer content 12345";

    BufferScenario() {
        super("buffers", "BUFFER TESTS", "buffer_test");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        ctx.test("Set buffer");
        Outcome set = ctx.mux("set-buffer", "-t", session, BUFFER_TEXT);
        ctx.expectSuccess(List.of(set), "Buffer set", "set-buffer failed");

        ctx.test("List buffers");
        Outcome listed = ctx.mux("list-buffers", "-t", session);
        ctx.expectCompleted(List.of(listed), "list-buffers executed", "list-buffers stalled");

        // Buffer and pane contents are not guaranteed to be observable, so a miss is
        // indeterminate rather than a failure.
        ctx.test("Show buffer");
        Outcome shown = ctx.mux("show-buffer", "-t", session);
        if (shown.stdout().contains(BUFFER_TEXT)) {
            ctx.ledger().recordPass("show-buffer returned the stored text");
        } else {
            ctx.ledger().recordSkip("show-buffer did not return the stored text (" + ScenarioContext.describe(shown) + ")");
        }

        ctx.test("Capture pane");
        Outcome captured = ctx.mux("capture-pane", "-t", session, "-p");
        if (captured.hasOutput()) {
            ctx.ledger().recordPass("capture-pane returned content");
        } else {
            ctx.ledger().recordSkip("capture-pane returned empty");
        }
    }
}
