package io.muxharness.scenario;

import io.muxharness.ledger.LedgerSnapshot;
import io.muxharness.testing.InMemoryMultiplexer;
import io.muxharness.testing.TestRigs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SwapRotateScenarioTest {

    @Test
    void conformingTargetSwapsAndRotates() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        TestRigs.Rig rig = TestRigs.rig(mux);

        new SwapRotateScenario().run(rig.context());

        Assertions.assertEquals(new LedgerSnapshot(2, 0, 0), rig.ledger().snapshot());
        Assertions.assertEquals(5L, mux.count("rotate-window"));
    }

    @Test
    void rejectedRotationFailsWithoutAffectingSwaps() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().breakCommand("rotate-window");
        TestRigs.Rig rig = TestRigs.rig(mux);

        new SwapRotateScenario().run(rig.context());

        Assertions.assertEquals(new LedgerSnapshot(1, 1, 0), rig.ledger().snapshot());
        Assertions.assertTrue(rig.console().contains("[PASS] Swap operations completed"));
        Assertions.assertTrue(rig.console().contains("[FAIL] rotate-window failed"));
    }

    @Test
    void stalledSwapFails() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().hangOn("swap-pane");
        TestRigs.Rig rig = TestRigs.rig(mux);

        new SwapRotateScenario().run(rig.context());

        Assertions.assertEquals(1L, rig.ledger().snapshot().failed());
        Assertions.assertTrue(rig.console().contains("[FAIL] swap-pane failed (timed out"));
    }
}
