package io.stsguard.health;

import io.stsguard.cluster.ControlPlane;
import io.stsguard.cluster.ControlPlaneException;
import io.stsguard.model.LiveWorkloadState;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.util.BoundedPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HealthVerifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(HealthVerifier.class);
    private static final int UNOBSERVED = -1;

    private final ControlPlane controlPlane;
    private final BoundedPoller poller;
    private final int stableChecks;

    public HealthVerifier(ControlPlane controlPlane, BoundedPoller poller, int stableChecks) {
        this.controlPlane = controlPlane;
        this.poller = poller;
        this.stableChecks = Math.max(1, stableChecks);
    }

    public ReadinessResult waitReady(WorkloadIdentity identity, int minReady, long timeoutMs) {
        return await(identity, minReady, timeoutMs, 1);
    }

    public ReadinessResult confirmStable(WorkloadIdentity identity, int minReady, long timeoutMs) {
        return await(identity, minReady, timeoutMs, stableChecks);
    }

    private ReadinessResult await(WorkloadIdentity identity, int minReady, long timeoutMs, int consecutive) {
        int target = Math.max(0, minReady);
        BoundedPoller.PollOutcome<Integer> outcome = poller.poll(
                timeoutMs,
                consecutive,
                () -> observeReady(identity),
                ready -> ready >= target
        );
        int observed = outcome.last() == null ? UNOBSERVED : outcome.last();
        return new ReadinessResult(
                outcome.satisfied() ? ReadinessResult.Status.READY : ReadinessResult.Status.TIMEOUT,
                target,
                observed,
                outcome.attempts(),
                outcome.elapsedMs()
        );
    }

    private int observeReady(WorkloadIdentity identity) {
        try {
            return controlPlane.get(identity)
                    .map(LiveWorkloadState::readyReplicas)
                    .orElse(UNOBSERVED);
        } catch (ControlPlaneException e) {
            LOGGER.debug("Readiness read for {} failed: {}", identity.key(), e.getMessage());
            return UNOBSERVED;
        }
    }
}
