package io.stsguard.cluster;

import io.stsguard.model.ErrorKind;

public class ApplyConflictException extends ControlPlaneException {
    public ApplyConflictException(String message) {
        super(ErrorKind.APPLY_CONFLICT, message);
    }

    public ApplyConflictException(String message, Throwable cause) {
        super(ErrorKind.APPLY_CONFLICT, message, cause);
    }
}
