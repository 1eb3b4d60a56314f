package io.stsguard.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.stsguard.util.Hashing;
import io.stsguard.util.Jsons;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row so a
 * truncated or edited file is detectable with {@link #verify()}. Appends from several loggers or
 * processes sharing the file are serialized on a sibling {@code .lock} file, and the chain head is
 * re-read under that lock.
 */
public final class AuditLogger {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of("password", "passwd", "secret", "token", "credential");
    private static final Map<Path, ReentrantLock> APPEND_LOCKS = new ConcurrentHashMap<>();

    private final Path auditFile;
    private final Path lockFile;
    private final String actor;

    public AuditLogger(Path auditFile, String actor) {
        this.auditFile = auditFile.toAbsolutePath().normalize();
        this.lockFile = this.auditFile.resolveSibling(this.auditFile.getFileName() + ".lock");
        this.actor = actor == null || actor.isBlank() ? "stsguard" : actor.trim();
        try {
            Files.createDirectories(this.auditFile.getParent());
            Files.newOutputStream(this.auditFile, StandardOpenOption.CREATE, StandardOpenOption.APPEND).close();
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("actor", actor);
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("operation_id", event.operationId());
        row.put("phase", event.phase());
        row.put("details", masked(event.details()));
        ReentrantLock appendLock = APPEND_LOCKS.computeIfAbsent(auditFile, k -> new ReentrantLock());
        appendLock.lock();
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            row.put("prev_hash", loadLastHash());
            row.put("hash", Hashing.sha256Hex(Jsons.toCompactJson(row)));
            Files.writeString(auditFile, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        } finally {
            appendLock.unlock();
        }
    }

    public String currentHash() {
        return loadLastHash();
    }

    public synchronized List<JsonNode> tail(int limit) {
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8).stream()
                    .filter(line -> line != null && !line.isBlank())
                    .toList();
            int from = Math.max(0, lines.size() - Math.max(1, limit));
            List<JsonNode> out = new ArrayList<>();
            for (String line : lines.subList(from, lines.size())) {
                out.add(Jsons.mapper().readTree(line));
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    public synchronized int verify() {
        int rows = 0;
        String expectedPrev = "";
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrev.equals(String.valueOf(row.get("prev_hash")))) {
                    throw new IllegalStateException("Audit chain broken at row " + (rows + 1));
                }
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!recomputed.equals(hash)) {
                    throw new IllegalStateException("Audit row hash mismatch at row " + (rows + 1));
                }
                expectedPrev = recomputed;
                rows++;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        return rows;
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private static Map<String, Object> masked(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        input.forEach((key, value) -> out.put(key, isSensitiveKey(key) ? MASK : value));
        return out;
    }

    private static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_HINTS.stream().anyMatch(normalized::contains);
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            String operationId,
            String phase,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, null, null, details == null ? Map.of() : details);
        }

        public static AuditEvent ofOperation(
                String action,
                String resource,
                String result,
                String operationId,
                String phase,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, resource, result, operationId, phase, details == null ? Map.of() : details);
        }
    }
}
