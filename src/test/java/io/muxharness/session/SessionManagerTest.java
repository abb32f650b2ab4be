package io.muxharness.session;

import io.muxharness.config.HarnessSettings;
import io.muxharness.probe.StateProbe;
import io.muxharness.process.Invocation;
import io.muxharness.testing.InMemoryMultiplexer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class SessionManagerTest {
    private static final HarnessSettings FAST = HarnessSettings.defaults().withoutDelays();

    @Test
    void createRecreatesFromScratchAndRegistersTheName() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        SessionManager sessions = manager(mux);

        Assertions.assertTrue(sessions.create("s1"));
        Assertions.assertTrue(mux.hasSession("s1"));
        Assertions.assertEquals(List.of("s1"), sessions.registry().names());

        List<List<String>> calls = mux.invocations();
        Assertions.assertEquals(List.of("kill-session", "-t", "s1"), calls.get(0));
        Assertions.assertEquals(List.of("new-session", "-s", "s1", "-d"), calls.get(1));
        Assertions.assertEquals(List.of("has-session", "-t", "s1"), calls.get(2));
    }

    @Test
    void createReplacesAStaleSession() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        mux.addSession("stale");
        mux.run(Invocation.of(FAST.commandTimeout(), "split-window", "-t", "stale"));
        Assertions.assertEquals(2, mux.paneCount("stale"));

        Assertions.assertTrue(manager(mux).create("stale"));
        Assertions.assertEquals(1, mux.paneCount("stale"));
    }

    @Test
    void failedCreateStillRegistersTheNameForCleanup() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().ignoreNextCreates(1);
        SessionManager sessions = manager(mux);

        Assertions.assertFalse(sessions.create("lost"));
        Assertions.assertEquals(List.of("lost"), sessions.registry().names());
    }

    @Test
    void killingAnAbsentSessionIsNotAnError() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        SessionManager sessions = manager(mux);

        Assertions.assertDoesNotThrow(() -> sessions.kill("never-created"));
        Assertions.assertDoesNotThrow(() -> sessions.kill("never-created"));
    }

    @Test
    void cleanupManyKeepsGoingPastFailures() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer();
        mux.addSession("a");
        mux.addSession("c");
        SessionManager sessions = manager(mux);

        int attempted = sessions.cleanupMany(List.of("a", "b", "c"));

        Assertions.assertEquals(3, attempted);
        Assertions.assertTrue(mux.sessionNames().isEmpty());
    }

    @Test
    void cleanupManySuppressesCrashingKills() {
        InMemoryMultiplexer mux = new InMemoryMultiplexer().explodeOn("kill-session");
        SessionManager sessions = manager(mux);

        Assertions.assertEquals(0, sessions.cleanupMany(List.of("a", "b")));
        Assertions.assertEquals(2L, mux.count("kill-session"));
    }

    @Test
    void registryDrainEmptiesAndKeepsInsertionOrder() {
        SessionRegistry registry = new SessionRegistry();
        registry.registerAll(List.of("b", "a", "b", " "));
        registry.register(null);

        Assertions.assertEquals(2, registry.size());
        Assertions.assertEquals(List.of("b", "a"), registry.drain());
        Assertions.assertEquals(0, registry.size());
    }

    private static SessionManager manager(InMemoryMultiplexer mux) {
        return new SessionManager(mux, new StateProbe(mux, FAST.commandTimeout()), new SessionRegistry(), FAST);
    }
}
