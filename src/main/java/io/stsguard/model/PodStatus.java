package io.stsguard.model;

public record PodStatus(
        String name,
        String phase,
        boolean ready
) {
}
