package io.stsguard.storage;

import io.stsguard.config.StsGuardConfig;
import io.stsguard.model.OperationRecord;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Operation records under {@code <root>/<namespace>/<name>/operations}, one timestamp-named file
 * per run. A run rewrites its file at every checkpoint; once a record carries an outcome the
 * file is never written again.
 */
public final class OperationStore {
    static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final StsGuardConfig config;

    public OperationStore(StsGuardConfig config) {
        this.config = config;
    }

    public Path save(OperationRecord record) {
        Path dir = config.operationsDir(record.identity());
        Path file = dir.resolve(fileName(record));
        try {
            Files.createDirectories(dir);
            if (Files.exists(file)) {
                OperationRecord existing = read(file);
                if (existing.finished()) {
                    throw new IllegalStateException("Operation record is final: " + record.operationId());
                }
            }
            Path tmp = dir.resolve(file.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toJson(record), StandardCharsets.UTF_8);
            moveReplacing(tmp, file);
            return file;
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist operation record: " + record.operationId(), e);
        }
    }

    public List<OperationRecord> list(WorkloadIdentity identity) {
        Path dir = config.operationsDir(identity);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<OperationRecord> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList()) {
                out.add(read(file));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list operation records for " + identity.key(), e);
        }
        return out;
    }

    public Optional<OperationRecord> latest(WorkloadIdentity identity) {
        List<OperationRecord> all = list(identity);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    public Optional<OperationRecord> find(WorkloadIdentity identity, String operationId) {
        return list(identity).stream()
                .filter(r -> r.operationId().equals(operationId))
                .findFirst();
    }

    private static OperationRecord read(Path file) throws IOException {
        return Jsons.mapper().readValue(file.toFile(), OperationRecord.class);
    }

    private static String fileName(OperationRecord record) {
        return FILE_TIMESTAMP.format(record.startedAt()) + "-" + record.operationId() + ".json";
    }

    static void moveReplacing(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
