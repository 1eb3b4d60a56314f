package io.stsguard.cluster;

import io.stsguard.model.LiveWorkloadState;
import io.stsguard.model.PodStatus;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.model.WorkloadSpec;

import java.util.List;
import java.util.Optional;

/**
 * Cluster control plane as seen by the orchestrator. Every method is a blocking network call and
 * reports failures as {@link ControlPlaneException} subtypes: {@link TransportException} when the
 * call did not reach a decision, and a rejection type when the control plane refused it.
 */
public interface ControlPlane {
    Optional<LiveWorkloadState> get(WorkloadIdentity identity);

    void apply(WorkloadSpec spec);

    void delete(WorkloadIdentity identity, boolean keepStorage);

    void scale(WorkloadIdentity identity, int replicas);

    List<PodStatus> listPods(WorkloadIdentity identity);
}
