package io.stsguard.model;

import java.time.Instant;

public record BackupArtifact(
        String artifactId,
        WorkloadIdentity source,
        ArtifactKind kind,
        String location,
        String sha256,
        long sizeBytes,
        Instant createdAt
) {
}
