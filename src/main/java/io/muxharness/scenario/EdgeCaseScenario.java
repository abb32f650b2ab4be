package io.muxharness.scenario;

import io.muxharness.config.HarnessSettings;
import io.muxharness.process.Outcome;

import java.util.List;

final class EdgeCaseScenario implements Scenario {
    static final String MISSING_SESSION = "nonexistent_xyz_999";
    static final List<String> SPECIAL_NAMES = List.of(
            "test-dash",
            "test_underscore",
            "Test123",
            "a".repeat(30)
    );

    @Override
    public String id() {
        return "edge-cases";
    }

    @Override
    public String title() {
        return "EDGE CASE TESTS";
    }

    @Override
    public List<String> sessionNames(HarnessSettings settings) {
        return SPECIAL_NAMES;
    }

    @Override
    public void run(ScenarioContext ctx) {
        ctx.test("Command on non-existent session");
        Outcome missing = ctx.mux("split-window", "-t", MISSING_SESSION);
        if (missing.signalsError()) {
            ctx.ledger().recordPass("Correctly handles non-existent session");
        } else {
            ctx.ledger().recordSkip("Error handling unclear (" + ScenarioContext.describe(missing) + ")");
        }

        ctx.test("Session with special names");
        int accepted = 0;
        for (String name : SPECIAL_NAMES) {
            try {
                if (ctx.sessions().create(name)) {
                    accepted++;
                }
            } finally {
                ctx.sessions().kill(name);
            }
        }
        // The target may legitimately restrict session names.
        if (accepted == SPECIAL_NAMES.size()) {
            ctx.ledger().recordPass("Various session names handled");
        } else {
            ctx.ledger().recordSkip(accepted + "/" + SPECIAL_NAMES.size() + " special session names accepted");
        }

        ctx.test("Help command");
        Outcome help = ctx.mux("--help");
        ctx.ledger().check(help.succeeded(), "Help command works", "Help command failed");

        ctx.test("Version command");
        Outcome version = ctx.mux("--version");
        ctx.ledger().check(version.succeeded(),
                "Version: " + version.stdout().strip(),
                "Version command failed");
    }
}
