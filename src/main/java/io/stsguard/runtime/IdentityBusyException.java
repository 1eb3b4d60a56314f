package io.stsguard.runtime;

import io.stsguard.model.WorkloadIdentity;

public class IdentityBusyException extends RuntimeException {
    public IdentityBusyException(WorkloadIdentity identity) {
        super("Another operation holds " + identity.key());
    }
}
