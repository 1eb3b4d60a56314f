package io.stsguard.model;

import java.util.List;

public record ReadinessProbe(
        List<String> command,
        Integer tcpPort,
        int initialDelaySeconds,
        int periodSeconds
) {
    public ReadinessProbe {
        command = command == null ? List.of() : List.copyOf(command);
    }
}
