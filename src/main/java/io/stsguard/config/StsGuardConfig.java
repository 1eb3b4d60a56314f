package io.stsguard.config;

import io.stsguard.model.WorkloadIdentity;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class StsGuardConfig {
    public static final String DEFAULT_ROOT = "stsguard-data";
    public static final String SETTINGS_FILE = "stsguard-settings.json";

    private final Path rootDir;

    public StsGuardConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static StsGuardConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new StsGuardConfig(resolved.toAbsolutePath().normalize());
    }

    static String sanitizeSegment(String raw) {
        String normalized = raw == null || raw.isBlank() ? "_" : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("..")) {
            value = value.replace("..", ".");
        }
        if (value.startsWith(".")) {
            value = "_" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditFile() {
        return rootDir.resolve("audit").resolve("stsguard-audit.jsonl");
    }

    public Path identityDir(WorkloadIdentity identity) {
        return rootDir.resolve(sanitizeSegment(identity.namespace())).resolve(sanitizeSegment(identity.name()));
    }

    public Path operationsDir(WorkloadIdentity identity) {
        return identityDir(identity).resolve("operations");
    }

    public Path backupsDir(WorkloadIdentity identity) {
        return identityDir(identity).resolve("backups");
    }

    public Path lockFile(WorkloadIdentity identity) {
        return identityDir(identity).resolve(".lock");
    }
}
