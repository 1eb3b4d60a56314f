package io.stsguard.kube;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.model.WorkloadSpec;
import io.stsguard.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class ManifestLoader {
    private static final YAMLMapper YAML = new YAMLMapper();

    private ManifestLoader() {
    }

    public static WorkloadSpec load(Path file, String namespaceOverride) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidManifestException("Manifest not found: " + file);
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidManifestException("Failed to read manifest: " + file, e);
        }
        return parse(text, namespaceOverride, file.toString());
    }

    public static WorkloadSpec parse(String text, String namespaceOverride, String source) {
        List<JsonNode> statefulSets = new ArrayList<>();
        try (MappingIterator<JsonNode> documents = YAML.readerFor(JsonNode.class).readValues(text)) {
            while (documents.hasNextValue()) {
                JsonNode document = documents.nextValue();
                if (document != null && "StatefulSet".equals(document.path("kind").asText())) {
                    statefulSets.add(document);
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new InvalidManifestException("Manifest " + source + " is not valid YAML or JSON: " + e.getMessage(), e);
        }
        if (statefulSets.size() != 1) {
            throw new InvalidManifestException("Manifest " + source + " must contain exactly one StatefulSet, found "
                    + statefulSets.size());
        }
        JsonNode document = statefulSets.get(0);
        String apiVersion = document.path("apiVersion").asText("");
        if (!"apps/v1".equals(apiVersion)) {
            throw new InvalidManifestException("Unsupported StatefulSet apiVersion '" + apiVersion + "' in " + source);
        }
        String declaredNamespace = document.path("metadata").path("namespace").asText("");
        String override = namespaceOverride == null ? "" : namespaceOverride.trim();
        if (!override.isEmpty() && !declaredNamespace.isEmpty() && !override.equals(declaredNamespace)) {
            throw new InvalidManifestException("Manifest " + source + " declares namespace " + declaredNamespace
                    + " but " + override + " was requested");
        }
        if (document.path("spec").path("selector").path("matchLabels").size() == 0) {
            throw new InvalidManifestException("StatefulSet in " + source + " has no spec.selector.matchLabels");
        }
        StatefulSet statefulSet;
        try {
            statefulSet = Jsons.mapper().treeToValue(document, StatefulSet.class);
        } catch (JsonProcessingException e) {
            throw new InvalidManifestException("StatefulSet in " + source + " does not match the apps/v1 schema: "
                    + e.getOriginalMessage(), e);
        }
        String namespace = !declaredNamespace.isEmpty()
                ? declaredNamespace
                : override.isEmpty() ? WorkloadIdentity.DEFAULT_NAMESPACE : override;
        try {
            return StatefulSetMapper.toSpec(statefulSet, namespace);
        } catch (IllegalArgumentException e) {
            throw new InvalidManifestException("StatefulSet in " + source + " is invalid: " + e.getMessage(), e);
        }
    }
}
