package io.muxharness.concurrent;

import java.util.List;

public record BatchResult(List<Boolean> outcomes, int required, boolean passed) {
    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public int successes() {
        int count = 0;
        for (Boolean ok : outcomes) {
            if (Boolean.TRUE.equals(ok)) {
                count++;
            }
        }
        return count;
    }

    public boolean allCompleted() {
        return successes() == size();
    }
}
