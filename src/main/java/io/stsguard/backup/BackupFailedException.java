package io.stsguard.backup;

import io.stsguard.model.WorkloadIdentity;

public class BackupFailedException extends RuntimeException {
    private final WorkloadIdentity identity;

    public BackupFailedException(WorkloadIdentity identity, String message) {
        super("Backup of " + identity.key() + " failed: " + message);
        this.identity = identity;
    }

    public BackupFailedException(WorkloadIdentity identity, String message, Throwable cause) {
        super("Backup of " + identity.key() + " failed: " + message, cause);
        this.identity = identity;
    }

    public WorkloadIdentity identity() {
        return identity;
    }
}
