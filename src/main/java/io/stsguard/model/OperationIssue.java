package io.stsguard.model;

import java.time.Instant;

public record OperationIssue(
        ErrorKind kind,
        Phase phase,
        String message,
        Instant at
) {
}
