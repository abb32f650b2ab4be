package io.muxharness.scenario;

import io.muxharness.ledger.LedgerSnapshot;
import io.muxharness.testing.InMemoryMultiplexer;
import io.muxharness.testing.TestRigs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SendKeysScenarioTest {

    @Test
    void conformingTargetAcceptsEveryKind() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        TestRigs.Rig rig = TestRigs.rig(mux);

        new SendKeysScenario().run(rig.context());

        Assertions.assertEquals(new LedgerSnapshot(4, 0, 0), rig.ledger().snapshot());
        Assertions.assertEquals(28L, mux.count("send-keys"));
    }

    @Test
    void rejectedKeysFailEveryGroup() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().breakCommand("send-keys");
        TestRigs.Rig rig = TestRigs.rig(mux);

        new SendKeysScenario().run(rig.context());

        Assertions.assertEquals(new LedgerSnapshot(0, 4, 0), rig.ledger().snapshot());
        Assertions.assertTrue(rig.console().contains("[FAIL] Basic send-keys failed"));
        Assertions.assertTrue(rig.console().contains("[FAIL] Rapid send-keys failed"));
        Assertions.assertTrue(mux.sessionNames().isEmpty());
    }
}
