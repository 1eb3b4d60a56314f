package io.stsguard.cluster;

import io.stsguard.model.ErrorKind;

public abstract class ControlPlaneException extends RuntimeException {
    private final ErrorKind kind;

    protected ControlPlaneException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ControlPlaneException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
