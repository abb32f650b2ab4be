package io.muxharness.ledger;

import java.time.Instant;

public record LedgerEntry(
        long seq,
        Verdict verdict,
        String scenario,
        String message,
        Instant recordedAt
) {
}
