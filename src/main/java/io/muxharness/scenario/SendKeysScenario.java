package io.muxharness.scenario;

import io.muxharness.process.Outcome;

import java.util.ArrayList;
import java.util.List;

final class SendKeysScenario extends SingleSessionScenario {
    private static final List<String> SPECIAL_KEYS = List.of("Tab", "Escape", "Up", "Down", "Left", "Right");
    private static final int RAPID_SENDS = 20;

    SendKeysScenario() {
        super("send-keys", "SEND-KEYS TESTS", "keys_test");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        ctx.test("Send basic keys");
        Outcome basic = ctx.mux("send-keys", "-t", session, "echo hello", "Enter");
        ctx.stepPause();
        ctx.expectSuccess(List.of(basic), "Basic keys sent", "Basic send-keys failed");

        ctx.test("Send literal keys");
        Outcome literal = ctx.mux("send-keys", "-l", "-t", session, "test literal string");
        ctx.expectSuccess(List.of(literal), "Literal keys sent", "Literal send-keys failed");

        ctx.test("Send special keys");
        List<Outcome> special = new ArrayList<>();
        for (String key : SPECIAL_KEYS) {
            special.add(ctx.mux("send-keys", "-t", session, key));
            ctx.burstPause();
        }
        ctx.expectSuccess(special, "Special keys sent", "Special key send failed");

        ctx.test("Rapid send-keys (" + RAPID_SENDS + " commands)");
        List<Outcome> rapid = new ArrayList<>();
        for (int i = 0; i < RAPID_SENDS; i++) {
            rapid.add(ctx.mux("send-keys", "-t", session, "echo test" + i, "Enter"));
            ctx.burstPause();
        }
        ctx.expectSuccess(rapid, "Rapid send completed", "Rapid send-keys failed");
    }
}
