package io.muxharness.config;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public final class HarnessConfig {
    public static final String DEFAULT_BINARY = "psmux";
    public static final String DEFAULT_SESSION_PREFIX = "mh_";
    public static final long DEFAULT_COMMAND_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_SETTLE_SHORT_MS = 300L;
    public static final long DEFAULT_SETTLE_LONG_MS = 1_500L;
    public static final long DEFAULT_STEP_DELAY_MS = 200L;
    public static final long DEFAULT_BURST_DELAY_MS = 50L;
    public static final int DEFAULT_CREATE_PROBE_ATTEMPTS = 1;
    public static final long DEFAULT_PROBE_INTERVAL_MS = 250L;
    public static final int DEFAULT_WORKER_POOL_SIZE = 5;
    public static final int DEFAULT_CONCURRENT_SESSIONS = 5;
    public static final int DEFAULT_NAVIGATION_WORKERS = 5;
    public static final int DEFAULT_NAVIGATION_OPS_PER_WORKER = 20;
    public static final int DEFAULT_STRESS_ITERATIONS = 25;
    public static final int DEFAULT_RAPID_CYCLES = 10;
    public static final int DEFAULT_QUORUM_TOLERANCE = 1;
    public static final long MIN_COMMAND_TIMEOUT_MS = 100L;

    private final List<String> targetCommand;
    private final HarnessSettings settings;

    public HarnessConfig(List<String> targetCommand, HarnessSettings settings) {
        if (targetCommand == null || targetCommand.isEmpty()) {
            throw new IllegalArgumentException("target command cannot be empty");
        }
        this.targetCommand = List.copyOf(targetCommand);
        this.settings = settings == null ? HarnessSettings.defaults() : settings;
    }

    public static HarnessConfig forBinary(String binary, String settingsFile) {
        String resolved = binary == null || binary.isBlank() ? DEFAULT_BINARY : binary.trim();
        HarnessSettings settings = settingsFile == null || settingsFile.isBlank()
                ? HarnessSettings.defaults()
                : HarnessSettings.load(Paths.get(settingsFile));
        List<String> command = new ArrayList<>();
        command.add(resolved);
        return new HarnessConfig(command, settings);
    }

    public List<String> targetCommand() {
        return targetCommand;
    }

    public String binaryLabel() {
        return String.join(" ", targetCommand);
    }

    public HarnessSettings settings() {
        return settings;
    }
}
