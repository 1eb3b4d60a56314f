package io.stsguard.cluster;

import io.stsguard.model.WorkloadIdentity;

public interface VolumeArchiver {
    byte[] archive(WorkloadIdentity identity);

    int extract(WorkloadIdentity identity, byte[] archive);
}
