package io.stsguard.lifecycle;

import io.stsguard.cluster.ApplyConflictException;
import io.stsguard.cluster.CallSites;
import io.stsguard.cluster.ControlPlane;
import io.stsguard.cluster.ControlPlaneException;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.model.WorkloadSpec;
import io.stsguard.util.BoundedPoller;

public final class LifecycleController {
    private static final int UNKNOWN = -1;

    private final ControlPlane controlPlane;
    private final BoundedPoller poller;

    public LifecycleController(ControlPlane controlPlane, BoundedPoller poller) {
        this.controlPlane = controlPlane;
        this.poller = poller;
    }

    public ScaleResult scaleTo(WorkloadIdentity identity, int replicas, long timeoutMs) {
        int target = Math.max(0, replicas);
        CallSites.retryTransportOnce(() -> controlPlane.scale(identity, target));
        BoundedPoller.PollOutcome<Integer> outcome = poller.poll(
                timeoutMs,
                () -> countPods(identity),
                count -> target == 0 ? count == 0 : count >= target
        );
        int observed = outcome.last() == null ? UNKNOWN : outcome.last();
        return new ScaleResult(target, outcome.satisfied(), observed, outcome.elapsedMs());
    }

    public DeleteResult deletePreservingStorage(WorkloadIdentity identity, long timeoutMs) {
        CallSites.retryTransportOnce(() -> controlPlane.delete(identity, true));
        BoundedPoller.PollOutcome<Boolean> outcome = poller.poll(
                timeoutMs,
                () -> exists(identity),
                Boolean.FALSE::equals
        );
        return new DeleteResult(outcome.satisfied(), outcome.elapsedMs());
    }

    // one retry on a stale-version conflict; a second one propagates
    public ApplyResult apply(WorkloadSpec spec, long timeoutMs) {
        boolean retried = false;
        try {
            CallSites.retryTransportOnce(() -> controlPlane.apply(spec));
        } catch (ApplyConflictException first) {
            retried = true;
            CallSites.retryTransportOnce(() -> controlPlane.get(spec.identity()));
            try {
                CallSites.retryTransportOnce(() -> controlPlane.apply(spec));
            } catch (ApplyConflictException second) {
                second.addSuppressed(first);
                throw second;
            }
        }
        BoundedPoller.PollOutcome<Boolean> outcome = poller.poll(
                timeoutMs,
                () -> exists(spec.identity()),
                Boolean.TRUE::equals
        );
        return new ApplyResult(retried, outcome.satisfied(), outcome.elapsedMs());
    }

    private int countPods(WorkloadIdentity identity) {
        try {
            return controlPlane.listPods(identity).size();
        } catch (ControlPlaneException e) {
            return UNKNOWN;
        }
    }

    private Boolean exists(WorkloadIdentity identity) {
        try {
            return controlPlane.get(identity).isPresent();
        } catch (ControlPlaneException e) {
            return null;
        }
    }
}
