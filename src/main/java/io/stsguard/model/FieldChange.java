package io.stsguard.model;

import com.fasterxml.jackson.databind.JsonNode;

public record FieldChange(
        String fieldPath,
        JsonNode liveValue,
        JsonNode desiredValue
) {
}
