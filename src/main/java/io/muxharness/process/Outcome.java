package io.muxharness.process;

import java.util.Locale;
import java.util.Optional;

/**
 * Result of one target invocation: either the process completed (with any exit code)
 * or it was abandoned after its timeout. Launch failures are not outcomes; they raise
 * {@link TargetSpawnException}.
 */
public interface Outcome {
    long durationMs();

    Optional<Completed> asCompleted();

    default boolean timedOut() {
        return asCompleted().isEmpty();
    }

    default boolean succeeded() {
        return asCompleted().map(c -> c.exitCode() == 0).orElse(false);
    }

    default String stdout() {
        return asCompleted().map(Completed::stdout).orElse("");
    }

    default boolean hasOutput() {
        return !stdout().isBlank();
    }

    /**
     * True when the target reported a failure it recognized: non-zero exit, or an
     * "error" / "not found" token on stderr. A timeout is not a recognized failure.
     */
    default boolean signalsError() {
        return asCompleted().map(c -> {
            if (c.exitCode() != 0) {
                return true;
            }
            String err = c.stderr().toLowerCase(Locale.ROOT);
            return err.contains("error") || err.contains("not found");
        }).orElse(false);
    }

    static Outcome completed(int exitCode, String stdout, String stderr, long durationMs) {
        return new Completed(exitCode, stdout, stderr, durationMs);
    }

    static Outcome timedOut(long durationMs) {
        return new TimedOut(durationMs);
    }

    record Completed(int exitCode, String stdout, String stderr, long durationMs) implements Outcome {
        public Completed {
            stdout = stdout == null ? "" : stdout;
            stderr = stderr == null ? "" : stderr;
        }

        @Override
        public Optional<Completed> asCompleted() {
            return Optional.of(this);
        }
    }

    record TimedOut(long durationMs) implements Outcome {
        @Override
        public Optional<Completed> asCompleted() {
            return Optional.empty();
        }
    }
}
