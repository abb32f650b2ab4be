package io.muxharness.scenario;

import io.muxharness.concurrent.BatchResult;
import io.muxharness.config.HarnessSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

final class ConcurrentOperationsScenario extends SingleSessionScenario {
    private static final String[] DIRECTIONS = {"-U", "-D", "-L", "-R"};

    ConcurrentOperationsScenario() {
        super("concurrent-ops", "CONCURRENT OPERATIONS TESTS", "concurrent_ops");
    }

    @Override
    protected void exercise(ScenarioContext ctx, String session) {
        prepareSplits(ctx, session, 3);

        HarnessSettings settings = ctx.settings();
        int workers = settings.navigationWorkers();
        int opsPerWorker = settings.navigationOpsPerWorker();
        int totalOps = workers * opsPerWorker;
        ctx.test("Concurrent pane navigation (" + totalOps + " ops)");

        // Individual navigation results are racy by nature; only completion is judged.
        AtomicInteger stalled = new AtomicInteger();
        List<Callable<Boolean>> units = new ArrayList<>(workers);
        for (int w = 0; w < workers; w++) {
            units.add(() -> {
                for (int i = 0; i < opsPerWorker; i++) {
                    String direction = DIRECTIONS[ThreadLocalRandom.current().nextInt(DIRECTIONS.length)];
                    if (ctx.mux("select-pane", direction, "-t", session).timedOut()) {
                        stalled.incrementAndGet();
                    }
                    ctx.burstPause();
                }
                return true;
            });
        }
        BatchResult batch = ctx.concurrency().runAll(units);
        if (stalled.get() > 0) {
            ctx.info(stalled.get() + " navigation ops timed out");
        }
        ctx.ledger().check(batch.passed(),
                totalOps + " concurrent navigation ops completed",
                "Only " + batch.successes() + "/" + workers + " navigation workers completed");
    }
}
