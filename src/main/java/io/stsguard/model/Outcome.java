package io.stsguard.model;

public enum Outcome {
    SUCCEEDED,
    DEGRADED,
    FAILED,
    BUSY
}
