package io.muxharness.util;

public final class Pauses {
    private Pauses() {
    }

    /**
     * Sleeps for the given delay. Returns false when interrupted; the interrupt flag is
     * restored so callers further up can still observe it.
     */
    public static boolean sleep(long delayMs) {
        if (delayMs <= 0L) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
