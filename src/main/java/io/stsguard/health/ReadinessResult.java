package io.stsguard.health;

public record ReadinessResult(
        Status status,
        int minReady,
        int observedReady,
        int attempts,
        long elapsedMs
) {
    public enum Status {
        READY,
        TIMEOUT
    }

    public boolean ready() {
        return status == Status.READY;
    }
}
