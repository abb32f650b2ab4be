package io.muxharness.scenario;

import io.muxharness.ledger.LedgerSnapshot;
import io.muxharness.testing.InMemoryMultiplexer;
import io.muxharness.testing.TestRigs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class EndToEndScenarioTest {

    @Test
    void conformingTargetPassesEveryCheck() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        TestRigs.Rig rig = TestRigs.rig(mux);

        new EndToEndScenario().run(rig.context());

        LedgerSnapshot snapshot = rig.ledger().snapshot();
        Assertions.assertEquals(4L, snapshot.passed());
        Assertions.assertEquals(0L, snapshot.failed());
        Assertions.assertFalse(mux.hasSession("e2e1"));
        Assertions.assertTrue(mux.invocations().contains(List.of("split-window", "-t", "does_not_exist_42")));
    }

    @Test
    void targetThatAcceptsMissingSessionsFails() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().acceptMissingTargets();
        TestRigs.Rig rig = TestRigs.rig(mux);

        new EndToEndScenario().run(rig.context());

        Assertions.assertEquals(1L, rig.ledger().snapshot().failed());
        Assertions.assertTrue(rig.console().contains("[FAIL] Missing session not rejected"));
    }

    @Test
    void failingSplitIsReportedWithTheTargetError() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().breakCommand("split-window");
        TestRigs.Rig rig = TestRigs.rig(mux);

        new EndToEndScenario().run(rig.context());

        Assertions.assertTrue(rig.console().contains("[FAIL] split-window failed (exit=1: error: injected failure"));
        Assertions.assertFalse(mux.hasSession("e2e1"));
    }

    @Test
    void teardownIsJudgedByHasSessionNotByTheKillExitCode() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().misreport("kill-session");
        TestRigs.Rig rig = TestRigs.rig(mux);

        new EndToEndScenario().run(rig.context());

        LedgerSnapshot snapshot = rig.ledger().snapshot();
        Assertions.assertEquals(4L, snapshot.passed());
        Assertions.assertEquals(0L, snapshot.failed());
        Assertions.assertFalse(mux.hasSession("e2e1"));
        Assertions.assertTrue(rig.console().contains("[PASS] has-session reports 'e2e1' gone"));
    }

    @Test
    void sessionSurvivingKillFailsWithTheKillError() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().breakCommand("kill-session");
        TestRigs.Rig rig = TestRigs.rig(mux);

        new EndToEndScenario().run(rig.context());

        Assertions.assertEquals(1L, rig.ledger().snapshot().failed());
        Assertions.assertTrue(rig.console().contains(
                "[FAIL] 'e2e1' survived kill-session (exit=1: error: injected failure for kill-session)"));
    }
}
