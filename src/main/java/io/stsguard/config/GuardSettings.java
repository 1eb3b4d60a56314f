package io.stsguard.config;

import io.stsguard.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record GuardSettings(
        long terminationTimeoutMs,
        long deleteTimeoutMs,
        long applyTimeoutMs,
        long readyTimeoutMs,
        long restoreReadyTimeoutMs,
        long stabilityTimeoutMs,
        long pollIntervalMs,
        long maxPollIntervalMs,
        double pollMultiplier,
        int stableChecks,
        long minBackupBytes,
        List<String> protectedFields,
        boolean allowVolumeExpansion,
        String pgUser,
        String pgDatabase,
        String pgContainer,
        String pgDataDir,
        long execTimeoutMs
) {
    public static final List<String> DEFAULT_PROTECTED_FIELDS = List.of("serviceName", "selector", "volumeClaimTemplates");

    public GuardSettings {
        protectedFields = protectedFields == null ? List.of() : List.copyOf(protectedFields);
    }

    public static GuardSettings defaults() {
        return new GuardSettings(
                300_000L,
                120_000L,
                120_000L,
                600_000L,
                300_000L,
                300_000L,
                5_000L,
                30_000L,
                1.5d,
                3,
                64L,
                DEFAULT_PROTECTED_FIELDS,
                true,
                "postgres",
                "postgres",
                "",
                "/var/lib/postgresql/data",
                600_000L
        );
    }

    public static GuardSettings load(Path file) {
        GuardSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            GuardSettingsFile parsed = Jsons.mapper().readValue(file.toFile(), GuardSettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file " + file + ": " + e.getMessage(), e);
        }
    }

    static GuardSettings fromFile(GuardSettingsFile file, GuardSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long pollInterval = sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 1L);
        long maxPollInterval = sanitizeLong(file.maxPollIntervalMs(), defaults.maxPollIntervalMs(), pollInterval);
        if (maxPollInterval < pollInterval) {
            maxPollInterval = pollInterval;
        }
        double multiplier = file.pollMultiplier() == null || file.pollMultiplier() < 1.0d
                ? defaults.pollMultiplier()
                : file.pollMultiplier();
        return new GuardSettings(
                sanitizeLong(file.terminationTimeoutMs(), defaults.terminationTimeoutMs(), 0L),
                sanitizeLong(file.deleteTimeoutMs(), defaults.deleteTimeoutMs(), 0L),
                sanitizeLong(file.applyTimeoutMs(), defaults.applyTimeoutMs(), 0L),
                sanitizeLong(file.readyTimeoutMs(), defaults.readyTimeoutMs(), 0L),
                sanitizeLong(file.restoreReadyTimeoutMs(), defaults.restoreReadyTimeoutMs(), 0L),
                sanitizeLong(file.stabilityTimeoutMs(), defaults.stabilityTimeoutMs(), 0L),
                pollInterval,
                maxPollInterval,
                multiplier,
                sanitizeInt(file.stableChecks(), defaults.stableChecks(), 1),
                sanitizeLong(file.minBackupBytes(), defaults.minBackupBytes(), 1L),
                sanitizeFields(file.protectedFields(), defaults.protectedFields()),
                file.allowVolumeExpansion() == null ? defaults.allowVolumeExpansion() : file.allowVolumeExpansion(),
                sanitizeString(file.pgUser(), defaults.pgUser()),
                sanitizeString(file.pgDatabase(), defaults.pgDatabase()),
                file.pgContainer() == null ? defaults.pgContainer() : file.pgContainer().trim(),
                sanitizeString(file.pgDataDir(), defaults.pgDataDir()),
                sanitizeLong(file.execTimeoutMs(), defaults.execTimeoutMs(), 1_000L)
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static String sanitizeString(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static List<String> sanitizeFields(List<String> values, List<String> fallback) {
        if (values == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String normalized = value.trim();
            boolean known = DEFAULT_PROTECTED_FIELDS.stream().anyMatch(f -> f.equalsIgnoreCase(normalized));
            if (!known) {
                throw new IllegalArgumentException("Unknown protected field: " + value
                        + " (expected one of " + String.join(", ", DEFAULT_PROTECTED_FIELDS) + ")");
            }
            String canonical = DEFAULT_PROTECTED_FIELDS.stream()
                    .filter(f -> f.toLowerCase(Locale.ROOT).equals(normalized.toLowerCase(Locale.ROOT)))
                    .findFirst()
                    .orElse(normalized);
            if (!out.contains(canonical)) {
                out.add(canonical);
            }
        }
        return List.copyOf(out);
    }

    record GuardSettingsFile(
            Long terminationTimeoutMs,
            Long deleteTimeoutMs,
            Long applyTimeoutMs,
            Long readyTimeoutMs,
            Long restoreReadyTimeoutMs,
            Long stabilityTimeoutMs,
            Long pollIntervalMs,
            Long maxPollIntervalMs,
            Double pollMultiplier,
            Integer stableChecks,
            Long minBackupBytes,
            List<String> protectedFields,
            Boolean allowVolumeExpansion,
            String pgUser,
            String pgDatabase,
            String pgContainer,
            String pgDataDir,
            Long execTimeoutMs
    ) {
    }
}
