package io.stsguard.model;

import java.util.List;

public record LiveWorkloadState(
        WorkloadSpec spec,
        int readyReplicas,
        List<PodStatus> pods,
        String resourceVersion
) {
    public LiveWorkloadState {
        pods = pods == null ? List.of() : List.copyOf(pods);
    }

    public WorkloadIdentity identity() {
        return spec.identity();
    }
}
