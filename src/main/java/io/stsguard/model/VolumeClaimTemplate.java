package io.stsguard.model;

import java.util.List;

public record VolumeClaimTemplate(
        String name,
        List<String> accessModes,
        String storageClassName,
        String storageRequest
) {
    public VolumeClaimTemplate {
        accessModes = accessModes == null ? List.of() : List.copyOf(accessModes);
    }
}
