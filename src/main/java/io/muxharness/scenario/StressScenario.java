package io.muxharness.scenario;

import io.muxharness.config.HarnessSettings;

import java.util.ArrayList;
import java.util.List;

final class StressScenario implements Scenario {
    private static final String SUFFIX = "stress_test";

    @Override
    public String id() {
        return "stress";
    }

    @Override
    public String title() {
        return "STRESS TESTS";
    }

    @Override
    public List<String> sessionNames(HarnessSettings settings) {
        List<String> names = new ArrayList<>();
        names.add(settings.sessionPrefix() + SUFFIX);
        for (int i = 0; i < settings.rapidCycles(); i++) {
            names.add(rapidName(settings, i));
        }
        return names;
    }

    @Override
    public void run(ScenarioContext ctx) {
        String session = ctx.session(SUFFIX);
        try {
            if (!ctx.sessions().create(session)) {
                ctx.ledger().recordFail("Could not create session '" + session + "'");
            } else {
                mixedOperations(ctx, session);
            }
        } finally {
            ctx.sessions().kill(session);
        }
        rapidCycles(ctx);
    }

    private void mixedOperations(ScenarioContext ctx, String session) {
        int iterations = ctx.settings().stressIterations();
        ctx.test("Stress: " + (iterations * 4) + " mixed operations");
        int ops = 0;
        int stalled = 0;
        for (int i = 0; i < iterations; i++) {
            stalled += ctx.mux("split-window", "-v", "-t", session).timedOut() ? 1 : 0;
            stalled += ctx.mux("select-pane", "-U", "-t", session).timedOut() ? 1 : 0;
            stalled += ctx.mux("resize-pane", "-D", "1", "-t", session).timedOut() ? 1 : 0;
            stalled += ctx.mux("send-keys", "-t", session, "echo test", "Enter").timedOut() ? 1 : 0;
            ops += 4;
            ctx.burstPause();
        }
        ctx.ledger().check(stalled == 0,
                ops + " operations completed",
                stalled + "/" + ops + " operations timed out");
    }

    private void rapidCycles(ScenarioContext ctx) {
        HarnessSettings settings = ctx.settings();
        int cycles = settings.rapidCycles();
        if (cycles <= 0) {
            return;
        }
        ctx.test("Stress: Rapid session create/destroy (" + cycles + " cycles)");
        int created = 0;
        for (int i = 0; i < cycles; i++) {
            String name = rapidName(settings, i);
            try {
                if (ctx.sessions().create(name)) {
                    created++;
                }
            } finally {
                ctx.sessions().kill(name);
            }
        }
        ctx.ledger().check(ctx.concurrency().quorum().accepts(created, cycles),
                cycles + " rapid cycles completed (" + created + " created)",
                "Only " + created + "/" + cycles + " rapid cycles created a session");
    }

    private static String rapidName(HarnessSettings settings, int index) {
        return settings.sessionPrefix() + "rapid_" + index;
    }
}
