package io.muxharness.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.muxharness.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public record HarnessSettings(
        long commandTimeoutMs,
        long settleShortMs,
        long settleLongMs,
        long stepDelayMs,
        long burstDelayMs,
        int createProbeAttempts,
        long probeIntervalMs,
        int workerPoolSize,
        int concurrentSessions,
        int navigationWorkers,
        int navigationOpsPerWorker,
        int stressIterations,
        int rapidCycles,
        int quorumTolerance,
        String sessionPrefix
) {
    public static HarnessSettings defaults() {
        return new HarnessSettings(
                HarnessConfig.DEFAULT_COMMAND_TIMEOUT_MS,
                HarnessConfig.DEFAULT_SETTLE_SHORT_MS,
                HarnessConfig.DEFAULT_SETTLE_LONG_MS,
                HarnessConfig.DEFAULT_STEP_DELAY_MS,
                HarnessConfig.DEFAULT_BURST_DELAY_MS,
                HarnessConfig.DEFAULT_CREATE_PROBE_ATTEMPTS,
                HarnessConfig.DEFAULT_PROBE_INTERVAL_MS,
                HarnessConfig.DEFAULT_WORKER_POOL_SIZE,
                HarnessConfig.DEFAULT_CONCURRENT_SESSIONS,
                HarnessConfig.DEFAULT_NAVIGATION_WORKERS,
                HarnessConfig.DEFAULT_NAVIGATION_OPS_PER_WORKER,
                HarnessConfig.DEFAULT_STRESS_ITERATIONS,
                HarnessConfig.DEFAULT_RAPID_CYCLES,
                HarnessConfig.DEFAULT_QUORUM_TOLERANCE,
                HarnessConfig.DEFAULT_SESSION_PREFIX
        );
    }

    /**
     * Reads a JSON settings file. A missing file yields the defaults; absent keys keep
     * their default and out-of-range values are clamped to the key's minimum.
     */
    public static HarnessSettings load(Path file) {
        HarnessSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load harness settings: " + file, e);
        }
    }

    static HarnessSettings fromFile(SettingsFile file, HarnessSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new HarnessSettings(
                sanitizeLong(file.commandTimeoutMs(), defaults.commandTimeoutMs(), HarnessConfig.MIN_COMMAND_TIMEOUT_MS),
                sanitizeLong(file.settleShortMs(), defaults.settleShortMs(), 0L),
                sanitizeLong(file.settleLongMs(), defaults.settleLongMs(), 0L),
                sanitizeLong(file.stepDelayMs(), defaults.stepDelayMs(), 0L),
                sanitizeLong(file.burstDelayMs(), defaults.burstDelayMs(), 0L),
                sanitizeInt(file.createProbeAttempts(), defaults.createProbeAttempts(), 1),
                sanitizeLong(file.probeIntervalMs(), defaults.probeIntervalMs(), 0L),
                sanitizeInt(file.workerPoolSize(), defaults.workerPoolSize(), 1),
                sanitizeInt(file.concurrentSessions(), defaults.concurrentSessions(), 1),
                sanitizeInt(file.navigationWorkers(), defaults.navigationWorkers(), 1),
                sanitizeInt(file.navigationOpsPerWorker(), defaults.navigationOpsPerWorker(), 1),
                sanitizeInt(file.stressIterations(), defaults.stressIterations(), 1),
                sanitizeInt(file.rapidCycles(), defaults.rapidCycles(), 0),
                sanitizeInt(file.quorumTolerance(), defaults.quorumTolerance(), 0),
                sanitizePrefix(file.sessionPrefix(), defaults.sessionPrefix())
        );
    }

    public Duration commandTimeout() {
        return Duration.ofMillis(commandTimeoutMs);
    }

    public HarnessSettings withoutDelays() {
        return new HarnessSettings(
                commandTimeoutMs,
                0L,
                0L,
                0L,
                0L,
                createProbeAttempts,
                0L,
                workerPoolSize,
                concurrentSessions,
                navigationWorkers,
                navigationOpsPerWorker,
                stressIterations,
                rapidCycles,
                quorumTolerance,
                sessionPrefix
        );
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizePrefix(String raw, String fallback) {
        if (raw == null) {
            return fallback;
        }
        String value = raw.trim();
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-';
            if (!ok) {
                return fallback;
            }
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long commandTimeoutMs,
            Long settleShortMs,
            Long settleLongMs,
            Long stepDelayMs,
            Long burstDelayMs,
            Integer createProbeAttempts,
            Long probeIntervalMs,
            Integer workerPoolSize,
            Integer concurrentSessions,
            Integer navigationWorkers,
            Integer navigationOpsPerWorker,
            Integer stressIterations,
            Integer rapidCycles,
            Integer quorumTolerance,
            String sessionPrefix
    ) {
    }
}
