package io.muxharness.scenario;

import io.muxharness.process.Outcome;

final class DisplayScenario extends SingleSessionScenario {
    static final String STATUS_FORMAT = "#S:#I:#W";

    DisplayScenario() {
        super("display", "DISPLAY COMMAND TESTS", "display_test");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        ctx.test("display-message with format");
        Outcome message = ctx.mux("display-message", "-t", session, "-p", STATUS_FORMAT);
        if (message.hasOutput()) {
            ctx.ledger().recordPass("display-message: " + message.stdout().strip());
        } else {
            ctx.ledger().recordSkip("display-message returned empty");
        }

        ctx.test("list-commands");
        Outcome commands = ctx.mux("list-commands");
        ctx.ledger().check(commands.hasOutput(), "list-commands works", "list-commands failed");

        ctx.test("list-keys");
        Outcome keys = ctx.mux("list-keys");
        if (keys.hasOutput()) {
            ctx.ledger().recordPass("list-keys works");
        } else {
            ctx.ledger().recordSkip("list-keys returned empty");
        }
    }
}
