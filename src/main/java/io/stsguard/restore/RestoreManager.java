package io.stsguard.restore;

import io.stsguard.cluster.DataStore;
import io.stsguard.cluster.DataStoreUnreachableException;
import io.stsguard.cluster.VolumeArchiver;
import io.stsguard.model.ArtifactKind;
import io.stsguard.model.BackupArtifact;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.storage.BackupArtifactStore;
import io.stsguard.util.BoundedPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RestoreManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(RestoreManager.class);

    private final DataStore dataStore;
    private final VolumeArchiver volumeArchiver;
    private final BackupArtifactStore artifactStore;
    private final BoundedPoller poller;
    private final long readyTimeoutMs;

    public RestoreManager(
            DataStore dataStore,
            VolumeArchiver volumeArchiver,
            BackupArtifactStore artifactStore,
            BoundedPoller poller,
            long readyTimeoutMs
    ) {
        this.dataStore = dataStore;
        this.volumeArchiver = volumeArchiver;
        this.artifactStore = artifactStore;
        this.poller = poller;
        this.readyTimeoutMs = readyTimeoutMs;
    }

    public RestoreResult restore(WorkloadIdentity identity, BackupArtifact artifact, String consumedBy) {
        if (artifact == null) {
            return RestoreResult.partial(null, "no artifact to restore");
        }
        String artifactId = artifact.artifactId();
        if (!identity.equals(artifact.source())) {
            return RestoreResult.partial(artifactId, "artifact belongs to " + artifact.source().key()
                    + ", refusing to restore into " + identity.key());
        }
        if (artifactStore.isConsumed(artifact)) {
            return RestoreResult.partial(artifactId, "artifact was already restored once");
        }
        byte[] payload;
        try {
            payload = artifactStore.read(artifact);
        } catch (RuntimeException e) {
            return RestoreResult.partial(artifactId, "artifact unreadable: " + e.getMessage());
        }
        BoundedPoller.PollOutcome<Boolean> ready = poller.poll(
                readyTimeoutMs,
                () -> acceptsConnections(identity),
                Boolean.TRUE::equals
        );
        if (!ready.satisfied()) {
            return RestoreResult.partial(artifactId, "data store did not accept connections within "
                    + readyTimeoutMs + " ms (" + ready.attempts() + " probes)");
        }
        int exitStatus;
        try {
            exitStatus = replay(identity, artifact.kind(), payload);
        } catch (RuntimeException e) {
            return RestoreResult.partial(artifactId, artifact.kind() + " replay failed: " + e.getMessage());
        }
        if (exitStatus != 0) {
            return RestoreResult.partial(artifactId, artifact.kind() + " replay exited with status " + exitStatus);
        }
        artifactStore.markConsumed(artifact, consumedBy);
        return RestoreResult.ok(artifactId);
    }

    private int replay(WorkloadIdentity identity, ArtifactKind kind, byte[] payload) {
        if (kind == ArtifactKind.VOLUME_ARCHIVE) {
            if (volumeArchiver == null) {
                throw new IllegalStateException("no volume archiver configured");
            }
            return volumeArchiver.extract(identity, payload);
        }
        return dataStore.restore(identity, payload);
    }

    private boolean acceptsConnections(WorkloadIdentity identity) {
        try {
            return dataStore.isReady(identity);
        } catch (DataStoreUnreachableException e) {
            LOGGER.debug("Data store for {} not reachable yet: {}", identity.key(), e.getMessage());
            return false;
        }
    }
}
