package io.muxharness.scenario;

import io.muxharness.config.HarnessSettings;

import java.util.List;

/**
 * A scenario working on one freshly created session that it always kills on the way
 * out, whatever happened in between.
 */
abstract class SingleSessionScenario implements Scenario {
    private final String id;
    private final String title;
    private final String suffix;

    SingleSessionScenario(String id, String title, String suffix) {
        this.id = id;
        this.title = title;
        this.suffix = suffix;
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final String title() {
        return title;
    }

    @Override
    public List<String> sessionNames(HarnessSettings settings) {
        return List.of(settings.sessionPrefix() + suffix);
    }

    @Override
    public final void run(ScenarioContext ctx) {
        String session = ctx.session(suffix);
        try {
            if (!ctx.sessions().create(session)) {
                ctx.ledger().recordFail("Could not create session '" + session + "'");
                return;
            }
            exercise(ctx, session);
        } finally {
            ctx.sessions().kill(session);
        }
    }

    protected abstract void exercise(ScenarioContext ctx, String session);

    /** Runs {@code count} vertical splits without judging them. */
    static void prepareSplits(ScenarioContext ctx, String session, int count) {
        for (int i = 0; i < count; i++) {
            ctx.mux("split-window", "-v", "-t", session);
            ctx.stepPause();
        }
    }
}
