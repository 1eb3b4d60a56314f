package io.stsguard.model;

public enum OperationMode {
    SAFE_APPLY,
    FORCE_RECREATE
}
