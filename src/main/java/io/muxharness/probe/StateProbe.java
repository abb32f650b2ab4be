package io.muxharness.probe;

import io.muxharness.process.Invocation;
import io.muxharness.process.Outcome;
import io.muxharness.process.TargetRunner;
import io.muxharness.util.Pauses;

import java.time.Duration;

/**
 * Answers existence and listing questions about target sessions.
 *
 * <p>A negative answer covers both "the session is absent" and "the query itself
 * failed or timed out"; callers accept that as a false-negative source.
 */
public final class StateProbe {
    private final TargetRunner runner;
    private final Duration timeout;

    public StateProbe(TargetRunner runner, Duration timeout) {
        this.runner = runner;
        this.timeout = timeout;
    }

    public boolean exists(String name) {
        return runner.run(Invocation.of(timeout, "has-session", "-t", name)).succeeded();
    }

    public boolean listContains(String substring) {
        return listOutput().contains(substring);
    }

    /** Standard output of {@code ls}, or an empty string when the listing failed. */
    public String listOutput() {
        Outcome outcome = runner.run(Invocation.of(timeout, "ls"));
        return outcome.asCompleted().map(Outcome.Completed::stdout).orElse("");
    }

    public boolean awaitExists(String name, int attempts, long intervalMs) {
        return await(name, true, attempts, intervalMs);
    }

    public boolean awaitAbsent(String name, int attempts, long intervalMs) {
        return await(name, false, attempts, intervalMs);
    }

    private boolean await(String name, boolean expected, int attempts, long intervalMs) {
        int remaining = Math.max(1, attempts);
        while (true) {
            if (exists(name) == expected) {
                return true;
            }
            remaining--;
            if (remaining <= 0 || !Pauses.sleep(intervalMs)) {
                return false;
            }
        }
    }
}
