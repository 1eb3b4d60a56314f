package io.stsguard.lifecycle;

public record DeleteResult(
        boolean gone,
        long elapsedMs
) {
}
