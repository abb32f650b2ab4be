package io.muxharness.scenario;

import io.muxharness.config.HarnessSettings;

import java.util.List;

final class SessionLifecycleScenario implements Scenario {
    private static final String SUFFIX = "lifecycle_test";

    @Override
    public String id() {
        return "session-lifecycle";
    }

    @Override
    public String title() {
        return "SESSION LIFECYCLE TESTS";
    }

    @Override
    public List<String> sessionNames(HarnessSettings settings) {
        return List.of(settings.sessionPrefix() + SUFFIX);
    }

    @Override
    public void run(ScenarioContext ctx) {
        String session = ctx.session(SUFFIX);

        ctx.test("Create session");
        if (ctx.sessions().create(session)) {
            ctx.ledger().recordPass("Session '" + session + "' created");
        } else {
            ctx.ledger().recordFail("Failed to create session '" + session + "'");
            ctx.sessions().kill(session);
            return;
        }

        ctx.test("List sessions");
        ctx.ledger().check(ctx.probe().listContains(session),
                "Session appears in list",
                "Session not in list");

        ctx.test("Kill session");
        ctx.sessions().kill(session);
        HarnessSettings settings = ctx.settings();
        ctx.ledger().check(
                ctx.probe().awaitAbsent(session, settings.createProbeAttempts(), settings.probeIntervalMs()),
                "Session killed successfully",
                "Session still exists after kill");
    }
}
