package io.muxharness.scenario;

import io.muxharness.config.HarnessSettings;
import io.muxharness.testing.InMemoryMultiplexer;
import io.muxharness.testing.TestRigs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class StressScenarioTest {

    @Test
    void mixedOperationsAndRapidCyclesPass() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        TestRigs.Rig rig = TestRigs.rig(mux);

        new StressScenario().run(rig.context());

        Assertions.assertEquals(2L, rig.ledger().snapshot().passed());
        Assertions.assertEquals(0L, rig.ledger().snapshot().failed());
        Assertions.assertEquals(HarnessSettings.defaults().stressIterations() + 0L, mux.count("resize-pane"));
        Assertions.assertTrue(rig.console().contains("100 operations completed"));
        Assertions.assertTrue(mux.sessionNames().isEmpty());
    }

    @Test
    void stalledOperationsFailTheMixedCheck() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().hangOn("select-pane");
        TestRigs.Rig rig = TestRigs.rig(mux);

        new StressScenario().run(rig.context());

        Assertions.assertEquals(1L, rig.ledger().snapshot().failed());
        Assertions.assertTrue(rig.console().contains("25/100 operations timed out"));
    }
}
