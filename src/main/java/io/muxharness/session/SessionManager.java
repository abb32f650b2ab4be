package io.muxharness.session;

import io.muxharness.config.HarnessSettings;
import io.muxharness.probe.StateProbe;
import io.muxharness.process.Invocation;
import io.muxharness.process.Outcome;
import io.muxharness.process.TargetRunner;
import io.muxharness.util.Pauses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

public final class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final TargetRunner runner;
    private final StateProbe probe;
    private final SessionRegistry registry;
    private final HarnessSettings settings;

    public SessionManager(TargetRunner runner, StateProbe probe, SessionRegistry registry, HarnessSettings settings) {
        this.runner = runner;
        this.probe = probe;
        this.registry = registry;
        this.settings = settings;
    }

    /**
     * Recreates {@code name} from scratch and reports whether the target lists it
     * afterwards. The creation command is spawned detached, so convergence is only
     * observed through the settle delay and the existence probe.
     */
    public boolean create(String name) {
        registry.register(name);
        runner.run(Invocation.of(settings.commandTimeout(), "kill-session", "-t", name));
        Pauses.sleep(settings.settleShortMs());

        runner.spawnDetached(List.of("new-session", "-s", name, "-d"));
        Pauses.sleep(settings.settleLongMs());

        boolean created = probe.awaitExists(name, settings.createProbeAttempts(), settings.probeIntervalMs());
        log.debug("create session {} -> {}", name, created);
        return created;
    }

    /** Destroys {@code name}; an absent session is not an error. */
    public void kill(String name) {
        Outcome outcome = runner.run(Invocation.of(settings.commandTimeout(), "kill-session", "-t", name));
        if (!outcome.succeeded()) {
            log.debug("kill-session {} returned {}", name, outcome);
        }
        Pauses.sleep(settings.settleShortMs());
    }

    /** Best-effort kill of every name; one failing kill never stops the sweep. */
    public int cleanupMany(Collection<String> names) {
        int attempted = 0;
        for (String name : names) {
            try {
                runner.run(Invocation.of(settings.commandTimeout(), "kill-session", "-t", name));
                attempted++;
            } catch (RuntimeException e) {
                log.warn("cleanup of session {} failed: {}", name, e.getMessage());
            }
        }
        return attempted;
    }

    public SessionRegistry registry() {
        return registry;
    }

    public StateProbe probe() {
        return probe;
    }
}
