package io.muxharness.scenario;

import io.muxharness.ledger.LedgerEntry;
import io.muxharness.ledger.LedgerSnapshot;
import io.muxharness.ledger.Verdict;
import io.muxharness.testing.InMemoryMultiplexer;
import io.muxharness.testing.TestRigs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class BufferScenarioTest {

    @Test
    void visibleBufferPasses() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        TestRigs.Rig rig = TestRigs.rig(mux);

        new BufferScenario().run(rig.context());

        LedgerSnapshot snapshot = rig.ledger().snapshot();
        Assertions.assertEquals(4L, snapshot.passed());
        Assertions.assertEquals(0L, snapshot.failed());
        Assertions.assertFalse(mux.hasSession("mh_buffer_test"));
    }

    @Test
    void unobservableBufferIsSkippedNotPassed() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().hideBuffers();
        TestRigs.Rig rig = TestRigs.rig(mux);

        new BufferScenario().run(rig.context());

        List<LedgerEntry> entries = rig.ledger().entries();
        LedgerEntry show = entries.stream()
                .filter(e -> e.message().startsWith("show-buffer"))
                .findFirst()
                .orElseThrow();
        Assertions.assertEquals(Verdict.SKIP, show.verdict());
        Assertions.assertEquals(0L, rig.ledger().snapshot().failed());
    }

    @Test
    void sessionThatNeverAppearsFailsAndStillGetsKilled() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().ignoreNextCreates(1);
        TestRigs.Rig rig = TestRigs.rig(mux);

        new BufferScenario().run(rig.context());

        Assertions.assertEquals(1L, rig.ledger().snapshot().failed());
        Assertions.assertEquals(1L, rig.ledger().snapshot().total());
        Assertions.assertEquals(0L, mux.count("set-buffer"));
        Assertions.assertEquals(2L, mux.count("kill-session"));
    }
}
