package io.muxharness.process;

public final class TargetSpawnException extends RuntimeException {
    public TargetSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
