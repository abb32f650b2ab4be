package io.muxharness.process;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

public record Invocation(List<String> args, Duration timeout) {
    public Invocation {
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException("invocation args cannot be empty");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("invocation timeout must be positive: " + timeout);
        }
        args = List.copyOf(args);
    }

    public static Invocation of(Duration timeout, String... args) {
        return new Invocation(Arrays.asList(args), timeout);
    }

    public String command() {
        return args.get(0);
    }

    @Override
    public String toString() {
        return String.join(" ", args);
    }
}
