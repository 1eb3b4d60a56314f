package io.stsguard.backup;

import io.stsguard.cluster.CallSites;
import io.stsguard.cluster.ControlPlane;
import io.stsguard.cluster.ControlPlaneException;
import io.stsguard.cluster.DataStore;
import io.stsguard.cluster.DataStoreUnreachableException;
import io.stsguard.cluster.DumpResult;
import io.stsguard.cluster.VolumeArchiver;
import io.stsguard.model.ArtifactKind;
import io.stsguard.model.BackupArtifact;
import io.stsguard.model.LiveWorkloadState;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.storage.BackupArtifactStore;
import io.stsguard.util.Ticker;

import java.time.Instant;

public final class BackupManager {
    private final ControlPlane controlPlane;
    private final DataStore dataStore;
    private final VolumeArchiver volumeArchiver;
    private final BackupArtifactStore artifactStore;
    private final long minBackupBytes;
    private final Ticker ticker;

    public BackupManager(
            ControlPlane controlPlane,
            DataStore dataStore,
            VolumeArchiver volumeArchiver,
            BackupArtifactStore artifactStore,
            long minBackupBytes,
            Ticker ticker
    ) {
        this.controlPlane = controlPlane;
        this.dataStore = dataStore;
        this.volumeArchiver = volumeArchiver;
        this.artifactStore = artifactStore;
        this.minBackupBytes = Math.max(1L, minBackupBytes);
        this.ticker = ticker == null ? Ticker.SYSTEM : ticker;
    }

    public BackupArtifact backup(WorkloadIdentity identity) {
        LiveWorkloadState live;
        try {
            live = CallSites.retryTransportOnce(() -> controlPlane.get(identity)).orElse(null);
        } catch (ControlPlaneException e) {
            throw new BackupFailedException(identity, "cannot read workload state: " + e.getMessage(), e);
        }
        if (live == null) {
            throw new BackupFailedException(identity, "workload does not exist");
        }
        if (live.readyReplicas() <= 0) {
            throw new BackupFailedException(identity, "workload has zero ready replicas, nothing consistent to read");
        }
        if (!storeAcceptsConnections(identity)) {
            return archiveVolume(identity);
        }
        DumpResult dump;
        try {
            dump = dataStore.dump(identity);
        } catch (DataStoreUnreachableException e) {
            return archiveVolume(identity);
        }
        if (!dump.succeeded()) {
            throw new BackupFailedException(identity, "dump exited with status " + dump.exitStatus()
                    + (dump.stderr().isBlank() ? "" : ": " + dump.stderr().trim()));
        }
        return persist(identity, ArtifactKind.LOGICAL_DUMP, dump.data());
    }

    private boolean storeAcceptsConnections(WorkloadIdentity identity) {
        try {
            return dataStore.isReady(identity);
        } catch (DataStoreUnreachableException e) {
            return false;
        }
    }

    private BackupArtifact archiveVolume(WorkloadIdentity identity) {
        if (volumeArchiver == null) {
            throw new BackupFailedException(identity, "data store unreachable and no volume archiver configured");
        }
        byte[] archive;
        try {
            archive = volumeArchiver.archive(identity);
        } catch (RuntimeException e) {
            throw new BackupFailedException(identity, "volume archive failed: " + e.getMessage(), e);
        }
        return persist(identity, ArtifactKind.VOLUME_ARCHIVE, archive);
    }

    private BackupArtifact persist(WorkloadIdentity identity, ArtifactKind kind, byte[] payload) {
        long size = payload == null ? 0L : payload.length;
        if (size <= minBackupBytes) {
            throw new BackupFailedException(identity, kind + " is " + size + " bytes, not above the "
                    + minBackupBytes + "-byte minimum; discarded");
        }
        try {
            return artifactStore.write(identity, kind, payload, Instant.ofEpochMilli(ticker.nowMs()));
        } catch (RuntimeException e) {
            throw new BackupFailedException(identity, "could not store artifact: " + e.getMessage(), e);
        }
    }
}
