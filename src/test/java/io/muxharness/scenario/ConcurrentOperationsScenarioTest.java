package io.muxharness.scenario;

import io.muxharness.ledger.LedgerSnapshot;
import io.muxharness.testing.InMemoryMultiplexer;
import io.muxharness.testing.TestRigs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ConcurrentOperationsScenarioTest {

    @Test
    void conformingTargetCompletesEveryNavigationOp() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        TestRigs.Rig rig = TestRigs.rig(mux);

        new ConcurrentOperationsScenario().run(rig.context());

        Assertions.assertEquals(new LedgerSnapshot(1, 0, 0), rig.ledger().snapshot());
        Assertions.assertEquals(100L, mux.count("select-pane"));
        Assertions.assertTrue(rig.console().contains("[PASS] 100 concurrent navigation ops completed"));
        Assertions.assertTrue(mux.sessionNames().isEmpty());
    }

    @Test
    void crashingWorkersFailTheBatch() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().explodeOn("select-pane");
        TestRigs.Rig rig = TestRigs.rig(mux);

        new ConcurrentOperationsScenario().run(rig.context());

        Assertions.assertEquals(1L, rig.ledger().snapshot().failed());
        Assertions.assertTrue(rig.console().contains("[FAIL] Only 0/5 navigation workers completed"));
        Assertions.assertTrue(mux.sessionNames().isEmpty());
    }

    @Test
    void stalledNavigationIsReportedButOnlyCompletionIsJudged() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().hangOn("select-pane");
        TestRigs.Rig rig = TestRigs.rig(mux);

        new ConcurrentOperationsScenario().run(rig.context());

        Assertions.assertEquals(1L, rig.ledger().snapshot().passed());
        Assertions.assertTrue(rig.console().contains("[INFO] 100 navigation ops timed out"));
    }
}
