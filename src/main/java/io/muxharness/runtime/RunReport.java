package io.muxharness.runtime;

import io.muxharness.ledger.LedgerEntry;

import java.time.Instant;
import java.util.List;

public record RunReport(
        String runId,
        String binary,
        String targetVersion,
        Instant startedAt,
        Instant finishedAt,
        long durationMs,
        List<String> scenarios,
        long passed,
        long failed,
        long skipped,
        long total,
        double passRate,
        int exitCode,
        List<String> sweptSessions,
        List<String> leakedSessions,
        List<LedgerEntry> entries
) {
}
