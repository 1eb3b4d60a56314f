package io.stsguard.storage;

import io.stsguard.config.StsGuardConfig;
import io.stsguard.model.ArtifactKind;
import io.stsguard.model.BackupArtifact;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.util.Hashing;
import io.stsguard.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

public final class BackupArtifactStore {
    private final StsGuardConfig config;
    private final Supplier<String> artifactIds;

    public BackupArtifactStore(StsGuardConfig config) {
        this(config, () -> UUID.randomUUID().toString().replace("-", "").substring(0, 12));
    }

    BackupArtifactStore(StsGuardConfig config, Supplier<String> artifactIds) {
        this.config = config;
        this.artifactIds = artifactIds;
    }

    public BackupArtifact write(WorkloadIdentity identity, ArtifactKind kind, byte[] payload, Instant createdAt) {
        String artifactId = artifactIds.get();
        String baseName = OperationStore.FILE_TIMESTAMP.format(createdAt) + "-" + artifactId;
        Path dir = config.backupsDir(identity);
        Path payloadFile = dir.resolve(baseName + "." + kind.extension());
        Path tmp = dir.resolve(baseName + ".partial");
        Path sidecar = sidecarOf(payloadFile);
        try {
            Files.createDirectories(dir);
            Files.write(tmp, payload);
            OperationStore.moveReplacing(tmp, payloadFile);
            BackupArtifact artifact = new BackupArtifact(
                    artifactId,
                    identity,
                    kind,
                    payloadFile.toString(),
                    Hashing.sha256Hex(payload),
                    payload.length,
                    createdAt
            );
            writeSidecar(sidecar, new ArtifactEntry(artifact, null, null));
            return artifact;
        } catch (IOException | RuntimeException e) {
            deleteAfterFailure(tmp, e);
            deleteAfterFailure(payloadFile, e);
            deleteAfterFailure(sidecarTmpOf(sidecar), e);
            throw new RuntimeException("Failed to store backup artifact for " + identity.key(), e);
        }
    }

    public byte[] read(BackupArtifact artifact) {
        Path payloadFile = Path.of(artifact.location());
        try {
            byte[] payload = Files.readAllBytes(payloadFile);
            if (payload.length != artifact.sizeBytes()) {
                throw new IllegalStateException("Artifact " + artifact.artifactId() + " size mismatch: expected "
                        + artifact.sizeBytes() + " bytes, found " + payload.length);
            }
            String sha = Hashing.sha256Hex(payload);
            if (!sha.equals(artifact.sha256())) {
                throw new IllegalStateException("Artifact " + artifact.artifactId() + " checksum mismatch");
            }
            return payload;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read backup artifact: " + artifact.location(), e);
        }
    }

    public synchronized void markConsumed(BackupArtifact artifact, String consumedBy) {
        Path sidecar = sidecarOf(Path.of(artifact.location()));
        ArtifactEntry entry = readSidecar(sidecar);
        if (entry.consumedAt() != null) {
            throw new IllegalStateException("Artifact " + artifact.artifactId() + " was already consumed by " + entry.consumedBy());
        }
        try {
            writeSidecar(sidecar, new ArtifactEntry(entry.artifact(), Instant.now(), consumedBy));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write artifact metadata: " + sidecar, e);
        }
    }

    public boolean isConsumed(BackupArtifact artifact) {
        Path sidecar = sidecarOf(Path.of(artifact.location()));
        return Files.exists(sidecar) && readSidecar(sidecar).consumedAt() != null;
    }

    public List<ArtifactEntry> list(WorkloadIdentity identity) {
        Path dir = config.backupsDir(identity);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<ArtifactEntry> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList()) {
                out.add(readSidecar(file));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list backup artifacts for " + identity.key(), e);
        }
        return out;
    }

    public Optional<BackupArtifact> find(WorkloadIdentity identity, String artifactId) {
        return list(identity).stream()
                .map(ArtifactEntry::artifact)
                .filter(a -> a.artifactId().equals(artifactId))
                .findFirst();
    }

    private static Path sidecarOf(Path payloadFile) {
        String name = payloadFile.getFileName().toString();
        int dot = name.indexOf('.');
        String base = dot < 0 ? name : name.substring(0, dot);
        return payloadFile.resolveSibling(base + ".json");
    }

    private static ArtifactEntry readSidecar(Path sidecar) {
        try {
            return Jsons.mapper().readValue(sidecar.toFile(), ArtifactEntry.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read artifact metadata: " + sidecar, e);
        }
    }

    private static void writeSidecar(Path sidecar, ArtifactEntry entry) throws IOException {
        Path tmp = sidecarTmpOf(sidecar);
        Files.writeString(tmp, Jsons.toJson(entry), StandardCharsets.UTF_8);
        OperationStore.moveReplacing(tmp, sidecar);
    }

    private static Path sidecarTmpOf(Path sidecar) {
        return sidecar.resolveSibling(sidecar.getFileName() + ".tmp");
    }

    private static void deleteAfterFailure(Path path, Exception primary) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanupFailure) {
            primary.addSuppressed(cleanupFailure);
        }
    }

    public record ArtifactEntry(
            BackupArtifact artifact,
            Instant consumedAt,
            String consumedBy
    ) {
    }
}
