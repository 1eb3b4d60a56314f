package io.stsguard.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record WorkloadSpec(
        WorkloadIdentity identity,
        String serviceName,
        Map<String, String> selector,
        List<VolumeClaimTemplate> volumeClaimTemplates,
        int replicas,
        String image,
        ReadinessProbe readinessProbe,
        JsonNode manifest
) {
    public WorkloadSpec {
        Objects.requireNonNull(identity, "identity");
        selector = selector == null ? Map.of() : Map.copyOf(selector);
        volumeClaimTemplates = volumeClaimTemplates == null ? List.of() : List.copyOf(volumeClaimTemplates);
        if (replicas < 0) {
            throw new IllegalArgumentException("replicas must be >= 0 for " + identity.key());
        }
    }

    public WorkloadSpec withReplicas(int count) {
        JsonNode updated = manifest;
        if (manifest != null && manifest.isObject()) {
            ObjectNode copy = manifest.deepCopy();
            JsonNode specNode = copy.get("spec");
            ObjectNode spec = specNode instanceof ObjectNode ? (ObjectNode) specNode : copy.putObject("spec");
            spec.put("replicas", count);
            updated = copy;
        }
        return new WorkloadSpec(identity, serviceName, selector, volumeClaimTemplates, count, image, readinessProbe, updated);
    }
}
