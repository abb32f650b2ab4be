package io.muxharness.concurrent;

/**
 * Pass decision over a batch of independent outcomes that tolerates up to
 * {@code tolerance} benign races. A non-empty batch always needs at least one success.
 */
public record QuorumRule(int tolerance) {
    public QuorumRule {
        if (tolerance < 0) {
            throw new IllegalArgumentException("quorum tolerance cannot be negative: " + tolerance);
        }
    }

    public int required(int batchSize) {
        if (batchSize <= 0) {
            return 0;
        }
        return Math.max(1, batchSize - tolerance);
    }

    public boolean accepts(int successes, int batchSize) {
        return successes >= required(batchSize);
    }
}
