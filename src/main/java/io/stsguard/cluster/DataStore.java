package io.stsguard.cluster;

import io.stsguard.model.WorkloadIdentity;

public interface DataStore {
    DumpResult dump(WorkloadIdentity identity);

    int restore(WorkloadIdentity identity, byte[] dump);

    boolean isReady(WorkloadIdentity identity);
}
