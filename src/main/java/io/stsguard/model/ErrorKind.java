package io.stsguard.model;

public enum ErrorKind {
    TRANSPORT_ERROR(true),
    REJECTED_IMMUTABLE_FIELD(false),
    REJECTED(true),
    BACKUP_FAILED(true),
    BACKUP_DISABLED(false),
    TERMINATION_TIMEOUT(false),
    DELETE_TIMEOUT(true),
    APPLY_CONFLICT(true),
    RESTORE_PARTIAL(true),
    VERIFICATION_TIMEOUT(true),
    INCOMPLETE_PRIOR_RUN(false),
    INVALID_INPUT(true),
    UNEXPECTED(true);

    private final boolean degrading;

    ErrorKind(boolean degrading) {
        this.degrading = degrading;
    }

    /**
     * Whether an issue of this kind, recorded after a destructive step, keeps the run from
     * ending {@link Outcome#SUCCEEDED}.
     */
    public boolean degrading() {
        return degrading;
    }
}
