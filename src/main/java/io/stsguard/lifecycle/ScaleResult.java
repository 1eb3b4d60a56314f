package io.stsguard.lifecycle;

public record ScaleResult(
        int targetReplicas,
        boolean reached,
        int observedPods,
        long elapsedMs
) {
}
