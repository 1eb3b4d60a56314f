package io.stsguard.cluster;

import io.stsguard.model.ErrorKind;

public class RejectedException extends ControlPlaneException {
    private final int code;

    public RejectedException(int code, String message, Throwable cause) {
        super(ErrorKind.REJECTED, message, cause);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
