package io.stsguard.lifecycle;

public record ApplyResult(
        boolean conflictRetried,
        boolean observed,
        long elapsedMs
) {
}
