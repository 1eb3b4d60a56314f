package io.stsguard.runtime;

import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.stsguard.backup.BackupFailedException;
import io.stsguard.backup.BackupManager;
import io.stsguard.cluster.CallSites;
import io.stsguard.cluster.ControlPlane;
import io.stsguard.cluster.ControlPlaneException;
import io.stsguard.cluster.DataStore;
import io.stsguard.cluster.RejectedImmutableFieldException;
import io.stsguard.cluster.VolumeArchiver;
import io.stsguard.config.GuardSettings;
import io.stsguard.config.StsGuardConfig;
import io.stsguard.diff.ManifestDiffer;
import io.stsguard.diff.ProtectedFieldPolicy;
import io.stsguard.health.HealthVerifier;
import io.stsguard.health.ReadinessResult;
import io.stsguard.lifecycle.ApplyResult;
import io.stsguard.lifecycle.DeleteResult;
import io.stsguard.lifecycle.LifecycleController;
import io.stsguard.lifecycle.ScaleResult;
import io.stsguard.model.ApplyPath;
import io.stsguard.model.ArtifactKind;
import io.stsguard.model.BackupArtifact;
import io.stsguard.model.ErrorKind;
import io.stsguard.model.FieldChange;
import io.stsguard.model.FieldDiff;
import io.stsguard.model.LiveWorkloadState;
import io.stsguard.model.OperationMode;
import io.stsguard.model.OperationRecord;
import io.stsguard.model.Outcome;
import io.stsguard.model.Phase;
import io.stsguard.model.PhaseMark;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.model.WorkloadSpec;
import io.stsguard.observability.AuditLogger;
import io.stsguard.restore.RestoreManager;
import io.stsguard.restore.RestoreResult;
import io.stsguard.storage.BackupArtifactStore;
import io.stsguard.storage.OperationStore;
import io.stsguard.util.BoundedPoller;
import io.stsguard.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Top-level driver for one workload identity. Chooses between an in-place apply and the
 * backup / scale-down / delete / recreate / restore / verify cycle, and records every step in an
 * {@link OperationRecord}.
 *
 * <p>Failure rules: an error before scale-down ends the run {@link Outcome#FAILED} with the live
 * workload untouched; an error afterwards is recorded as an issue tagged with the phase reached
 * and the run ends {@link Outcome#DEGRADED}.
 */
public final class SafeApplyOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SafeApplyOrchestrator.class);

    private final ControlPlane controlPlane;
    private final GuardSettings settings;
    private final Ticker ticker;
    private final ManifestDiffer differ;
    private final BackupManager backupManager;
    private final LifecycleController lifecycle;
    private final RestoreManager restoreManager;
    private final HealthVerifier healthVerifier;
    private final OperationStore operationStore;
    private final BackupArtifactStore artifactStore;
    private final AuditLogger auditLogger;
    private final IdentityLocks locks;

    public SafeApplyOrchestrator(
            StsGuardConfig config,
            GuardSettings settings,
            ControlPlane controlPlane,
            DataStore dataStore,
            VolumeArchiver volumeArchiver,
            Ticker ticker
    ) {
        this.controlPlane = controlPlane;
        this.settings = settings;
        this.ticker = ticker == null ? Ticker.SYSTEM : ticker;
        BoundedPoller backoff = new BoundedPoller(
                this.ticker,
                settings.pollIntervalMs(),
                settings.pollMultiplier(),
                settings.maxPollIntervalMs()
        );
        this.differ = new ManifestDiffer(ProtectedFieldPolicy.fromSettings(settings));
        this.operationStore = new OperationStore(config);
        this.artifactStore = new BackupArtifactStore(config);
        this.auditLogger = new AuditLogger(config.auditFile(), "stsguard");
        this.locks = new IdentityLocks(config);
        this.backupManager = new BackupManager(
                controlPlane, dataStore, volumeArchiver, artifactStore, settings.minBackupBytes(), this.ticker);
        this.lifecycle = new LifecycleController(controlPlane, backoff);
        this.restoreManager = new RestoreManager(
                dataStore, volumeArchiver, artifactStore, backoff, settings.restoreReadyTimeoutMs());
        this.healthVerifier = new HealthVerifier(
                controlPlane, BoundedPoller.fixed(this.ticker, settings.pollIntervalMs()), settings.stableChecks());
    }

    public OperationRecord safeApply(WorkloadSpec desired, boolean backupEnabled) {
        return run(desired, backupEnabled, OperationMode.SAFE_APPLY);
    }

    public OperationRecord forceRecreate(WorkloadSpec desired, boolean backupEnabled) {
        return run(desired, backupEnabled, OperationMode.FORCE_RECREATE);
    }

    public FieldDiff diffCheck(WorkloadIdentity identity, WorkloadSpec desired) {
        requireSameIdentity(identity, desired);
        LiveWorkloadState live = CallSites.retryTransportOnce(() -> controlPlane.get(identity)).orElse(null);
        return differ.diff(live, desired);
    }

    public BackupArtifact backupNow(WorkloadIdentity identity) {
        try (IdentityLocks.Lease ignored = locks.tryAcquire(identity)
                .orElseThrow(() -> new IdentityBusyException(identity))) {
            try {
                BackupArtifact artifact = backupManager.backup(identity);
                auditLogger.log(AuditLogger.AuditEvent.of("backup.create", identity.key(), "ok", Map.of(
                        "artifact_id", artifact.artifactId(),
                        "kind", artifact.kind().name(),
                        "size_bytes", artifact.sizeBytes()
                )));
                return artifact;
            } catch (BackupFailedException e) {
                auditLogger.log(AuditLogger.AuditEvent.of("backup.create", identity.key(), "failed", Map.of(
                        "reason", e.getMessage()
                )));
                throw e;
            }
        }
    }

    /**
     * Replays a logical dump into the running workload. Volume archives overwrite the data
     * directory and are only replayed by the recreate path, before the new pods take writes.
     */
    public RestoreResult restoreNow(WorkloadIdentity identity, String artifactId) {
        BackupArtifact artifact = artifactStore.find(identity, artifactId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No artifact " + artifactId + " stored for " + identity.key()));
        if (artifact.kind() == ArtifactKind.VOLUME_ARCHIVE) {
            throw new IllegalArgumentException("Artifact " + artifactId
                    + " is a volume archive and is only replayed into a freshly recreated workload");
        }
        try (IdentityLocks.Lease ignored = locks.tryAcquire(identity)
                .orElseThrow(() -> new IdentityBusyException(identity))) {
            RestoreResult result = restoreManager.restore(identity, artifact, "manual-" + newOperationId());
            auditLogger.log(AuditLogger.AuditEvent.of("backup.restore", identity.key(),
                    result.restored() ? "ok" : "partial", Map.of(
                            "artifact_id", artifactId,
                            "detail", result.detail()
                    )));
            return result;
        }
    }

    public List<OperationRecord> history(WorkloadIdentity identity, int limit) {
        List<OperationRecord> all = operationStore.list(identity);
        return all.subList(0, Math.min(all.size(), Math.max(1, limit)));
    }

    public List<BackupArtifactStore.ArtifactEntry> artifacts(WorkloadIdentity identity) {
        return artifactStore.list(identity);
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    private OperationRecord run(WorkloadSpec desired, boolean backupEnabled, OperationMode mode) {
        WorkloadIdentity identity = desired.identity();
        String operationId = newOperationId();
        Optional<IdentityLocks.Lease> lease = locks.tryAcquire(identity);
        if (lease.isEmpty()) {
            LOGGER.warn("{} is locked by another operation, refusing {}", identity.key(), mode);
            auditLogger.log(AuditLogger.AuditEvent.ofOperation(
                    "operation.busy", identity.key(), "refused", operationId, Phase.IDLE.name(), Map.of(
                            "mode", mode.name()
                    )));
            return busyRecord(operationId, identity, mode, backupEnabled);
        }
        try (IdentityLocks.Lease held = lease.get()) {
            OperationRecord prior = operationStore.latest(identity)
                    .filter(record -> !record.finished())
                    .orElse(null);
            OperationRecorder recorder = new OperationRecorder(
                    operationStore, auditLogger, ticker, operationId, identity, mode, backupEnabled);
            OperationRecord result = execute(recorder, desired, backupEnabled, mode, prior);
            LOGGER.info("{} {} finished {} at phase {}", mode, identity.key(), result.outcome(), result.phaseReached());
            return result;
        }
    }

    private OperationRecord execute(
            OperationRecorder recorder,
            WorkloadSpec desired,
            boolean backupEnabled,
            OperationMode mode,
            OperationRecord prior
    ) {
        try {
            recorder.begin();
            if (prior != null) {
                noteIncompletePrior(recorder, prior);
            }
            recorder.enter(Phase.DIFFING, null);
            WorkloadIdentity identity = desired.identity();
            LiveWorkloadState live = CallSites.retryTransportOnce(() -> controlPlane.get(identity)).orElse(null);
            FieldDiff diff = differ.diff(live, desired);
            recorder.diff(diff);
            if (live == null) {
                return create(recorder, desired);
            }
            if (mode == OperationMode.FORCE_RECREATE || !diff.isEmpty()) {
                return recreate(recorder, desired, backupEnabled,
                        mode == OperationMode.FORCE_RECREATE ? "forced" : diff.changes().size() + " protected change(s)");
            }
            return fastApply(recorder, desired, backupEnabled, diff);
        } catch (BackupFailedException e) {
            return abort(recorder, ErrorKind.BACKUP_FAILED, e);
        } catch (ControlPlaneException e) {
            return abort(recorder, e.kind(), e);
        } catch (RuntimeException e) {
            return abort(recorder, ErrorKind.UNEXPECTED, e);
        }
    }

    private OperationRecord create(OperationRecorder recorder, WorkloadSpec desired) {
        recorder.path(ApplyPath.CREATE);
        recorder.enter(Phase.FAST_APPLYING, "create");
        ApplyResult applied = lifecycle.apply(desired, settings.applyTimeoutMs());
        return verifyInPlace(recorder, desired, applied);
    }

    private OperationRecord fastApply(
            OperationRecorder recorder,
            WorkloadSpec desired,
            boolean backupEnabled,
            FieldDiff diff
    ) {
        recorder.path(ApplyPath.FAST);
        recorder.enter(Phase.FAST_APPLYING, null);
        ApplyResult applied;
        try {
            applied = lifecycle.apply(desired, settings.applyTimeoutMs());
        } catch (RejectedImmutableFieldException e) {
            recorder.issue(ErrorKind.REJECTED_IMMUTABLE_FIELD, e.getMessage());
            FieldDiff annotated = diff;
            for (String field : e.fields()) {
                annotated = annotated.plus(new FieldChange(
                        field, NullNode.getInstance(), TextNode.valueOf("rejected by control plane")));
            }
            recorder.diff(annotated);
            LOGGER.info("{} rejected an in-place update of {}, escalating to recreate",
                    desired.identity().key(), e.fields());
            return recreate(recorder, desired, backupEnabled, "escalated after immutable-field rejection");
        }
        return verifyInPlace(recorder, desired, applied);
    }

    private OperationRecord verifyInPlace(OperationRecorder recorder, WorkloadSpec desired, ApplyResult applied) {
        WorkloadIdentity identity = desired.identity();
        if (!applied.observed()) {
            recorder.issue(ErrorKind.VERIFICATION_TIMEOUT,
                    identity.key() + " not observable " + applied.elapsedMs() + " ms after apply");
            recorder.enter(Phase.VERIFYING, null);
            return recorder.finish(Phase.DEGRADED);
        }
        recorder.enter(Phase.VERIFYING, desired.replicas() + " ready replica(s)");
        ReadinessResult ready = healthVerifier.waitReady(identity, desired.replicas(), settings.readyTimeoutMs());
        if (!ready.ready()) {
            recorder.issue(ErrorKind.VERIFICATION_TIMEOUT, readinessMessage(ready));
            return recorder.finish(Phase.DEGRADED);
        }
        return recorder.finish(Phase.SUCCEEDED);
    }

    private OperationRecord recreate(
            OperationRecorder recorder,
            WorkloadSpec desired,
            boolean backupEnabled,
            String reason
    ) {
        WorkloadIdentity identity = desired.identity();
        recorder.path(ApplyPath.RECREATE);
        BackupArtifact artifact = null;
        if (backupEnabled) {
            recorder.enter(Phase.BACKING_UP, reason);
            artifact = backupManager.backup(identity);
            recorder.artifact(artifact);
            auditLogger.log(AuditLogger.AuditEvent.ofOperation(
                    "backup.create", identity.key(), "ok", recorder.operationId(), Phase.BACKING_UP.name(), Map.of(
                            "artifact_id", artifact.artifactId(),
                            "kind", artifact.kind().name(),
                            "size_bytes", artifact.sizeBytes(),
                            "sha256", artifact.sha256()
                    )));
        } else {
            recorder.issue(ErrorKind.BACKUP_DISABLED, "recreating " + identity.key() + " without a backup");
        }

        recorder.enter(Phase.SCALING_DOWN, backupEnabled ? null : reason);
        ScaleResult scaled = lifecycle.scaleTo(identity, 0, settings.terminationTimeoutMs());
        if (!scaled.reached()) {
            recorder.issue(ErrorKind.TERMINATION_TIMEOUT, scaled.observedPods() + " pod(s) still present after "
                    + scaled.elapsedMs() + " ms, deleting anyway");
        }

        recorder.enter(Phase.DELETING, "storage claims preserved");
        DeleteResult deleted = lifecycle.deletePreservingStorage(identity, settings.deleteTimeoutMs());
        if (!deleted.gone()) {
            recorder.issue(ErrorKind.DELETE_TIMEOUT, identity.key() + " still present after "
                    + deleted.elapsedMs() + " ms, not recreating");
            return recorder.finish(Phase.DEGRADED);
        }

        recorder.enter(Phase.RECREATING, null);
        ApplyResult applied = lifecycle.apply(desired, settings.applyTimeoutMs());
        ReadinessResult firstReady = healthVerifier.waitReady(identity, 1, settings.readyTimeoutMs());
        if (!applied.observed() || !firstReady.ready()) {
            String skipped = artifact == null ? "" : ", restore of " + artifact.artifactId() + " skipped";
            recorder.issue(ErrorKind.VERIFICATION_TIMEOUT, readinessMessage(firstReady) + skipped);
            recorder.enter(Phase.VERIFYING, "restore skipped");
            return recorder.finish(Phase.DEGRADED);
        }

        if (artifact != null) {
            recorder.enter(Phase.RESTORING, artifact.artifactId());
            RestoreResult restored = restoreManager.restore(identity, artifact, recorder.operationId());
            if (!restored.restored()) {
                recorder.issue(ErrorKind.RESTORE_PARTIAL, restored.detail());
            }
        }

        recorder.enter(Phase.VERIFYING, desired.replicas() + " ready replica(s), stable");
        ReadinessResult stable = healthVerifier.confirmStable(
                identity, desired.replicas(), settings.stabilityTimeoutMs());
        if (!stable.ready()) {
            recorder.issue(ErrorKind.VERIFICATION_TIMEOUT, readinessMessage(stable));
            return recorder.finish(Phase.DEGRADED);
        }
        return recorder.finish(Phase.SUCCEEDED);
    }

    private void noteIncompletePrior(OperationRecorder recorder, OperationRecord prior) {
        recorder.resumedFrom(prior.operationId());
        StringBuilder message = new StringBuilder("operation ")
                .append(prior.operationId())
                .append(" stopped at phase ")
                .append(prior.phaseReached());
        if (prior.artifact() != null) {
            message.append("; artifact ").append(prior.artifact().artifactId())
                    .append(" left for manual restore");
        }
        LOGGER.warn("{}: {}", prior.identity().key(), message);
        recorder.issue(ErrorKind.INCOMPLETE_PRIOR_RUN, message.toString());
    }

    private OperationRecord abort(OperationRecorder recorder, ErrorKind kind, RuntimeException error) {
        if (recorder.finished()) {
            throw error;
        }
        LOGGER.warn("Operation {} stopped in phase {}: {}", recorder.operationId(), recorder.phase(), error.getMessage());
        recorder.issue(kind, error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage());
        return recorder.finish(Phase.FAILED);
    }

    private OperationRecord busyRecord(
            String operationId,
            WorkloadIdentity identity,
            OperationMode mode,
            boolean backupEnabled
    ) {
        Instant now = Instant.ofEpochMilli(ticker.nowMs());
        return new OperationRecord(
                operationId,
                identity,
                mode,
                ApplyPath.NONE,
                backupEnabled,
                List.of(new PhaseMark(Phase.IDLE, now, "identity locked")),
                Phase.IDLE,
                Outcome.BUSY,
                List.of(),
                null,
                null,
                null,
                now,
                now
        );
    }

    private static String readinessMessage(ReadinessResult result) {
        return "observed " + result.observedReady() + " of " + result.minReady() + " ready replica(s) after "
                + result.elapsedMs() + " ms (" + result.attempts() + " probes)";
    }

    private static void requireSameIdentity(WorkloadIdentity identity, WorkloadSpec desired) {
        if (!identity.equals(desired.identity())) {
            throw new IllegalArgumentException("Manifest describes " + desired.identity().key()
                    + ", not " + identity.key());
        }
    }

    private static String newOperationId() {
        return UUID.randomUUID().toString();
    }
}
