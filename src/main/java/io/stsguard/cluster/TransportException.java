package io.stsguard.cluster;

import io.stsguard.model.ErrorKind;

public class TransportException extends ControlPlaneException {
    public TransportException(String message) {
        super(ErrorKind.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_ERROR, message, cause);
    }
}
