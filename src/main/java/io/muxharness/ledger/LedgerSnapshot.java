package io.muxharness.ledger;

public record LedgerSnapshot(long passed, long failed, long skipped) {
    public long total() {
        return passed + failed + skipped;
    }

    /** Percentage of passed checks, 0 when nothing was recorded. */
    public double passRate() {
        long total = total();
        return total == 0L ? 0.0d : (passed * 100.0d) / total;
    }

    public boolean clean() {
        return failed == 0L;
    }
}
