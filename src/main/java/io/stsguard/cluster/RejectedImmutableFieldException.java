package io.stsguard.cluster;

import io.stsguard.model.ErrorKind;

import java.util.List;

public class RejectedImmutableFieldException extends ControlPlaneException {
    private final List<String> fields;

    public RejectedImmutableFieldException(String message, List<String> fields) {
        super(ErrorKind.REJECTED_IMMUTABLE_FIELD, message);
        this.fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public RejectedImmutableFieldException(String message, List<String> fields, Throwable cause) {
        super(ErrorKind.REJECTED_IMMUTABLE_FIELD, message, cause);
        this.fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public List<String> fields() {
        return fields;
    }
}
