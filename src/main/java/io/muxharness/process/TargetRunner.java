package io.muxharness.process;

import java.util.List;

public interface TargetRunner {
    /**
     * Runs the target with the given arguments and waits for it up to the invocation
     * timeout. Never throws for a non-zero exit or a timeout.
     *
     * @throws TargetSpawnException when the target cannot be launched at all
     */
    Outcome run(Invocation invocation);

    /**
     * Starts the target without waiting for it and without capturing its output.
     *
     * @throws TargetSpawnException when the target cannot be launched at all
     */
    void spawnDetached(List<String> args);
}
