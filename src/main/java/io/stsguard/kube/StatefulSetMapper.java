package io.stsguard.kube;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimSpec;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.Probe;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetSpec;
import io.fabric8.kubernetes.api.model.apps.StatefulSetStatus;
import io.stsguard.model.LiveWorkloadState;
import io.stsguard.model.PodStatus;
import io.stsguard.model.ReadinessProbe;
import io.stsguard.model.VolumeClaimTemplate;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.model.WorkloadSpec;
import io.stsguard.util.Jsons;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class StatefulSetMapper {
    static final String TERMINATING = "Terminating";

    private StatefulSetMapper() {
    }

    public static WorkloadSpec toSpec(StatefulSet statefulSet, String defaultNamespace) {
        ObjectMeta metadata = statefulSet.getMetadata();
        if (metadata == null) {
            throw new IllegalArgumentException("StatefulSet has no metadata");
        }
        WorkloadIdentity identity = WorkloadIdentity.of(
                metadata.getNamespace() == null ? defaultNamespace : metadata.getNamespace(),
                metadata.getName()
        );
        StatefulSetSpec spec = statefulSet.getSpec();
        if (spec == null) {
            return new WorkloadSpec(identity, null, Map.of(), List.of(), 1, null, null, tree(statefulSet));
        }
        Map<String, String> selector = Optional.ofNullable(spec.getSelector())
                .map(LabelSelector::getMatchLabels)
                .orElse(Map.of());
        List<VolumeClaimTemplate> templates = new ArrayList<>();
        if (spec.getVolumeClaimTemplates() != null) {
            for (PersistentVolumeClaim claim : spec.getVolumeClaimTemplates()) {
                templates.add(toTemplate(claim));
            }
        }
        Container container = firstContainer(spec.getTemplate());
        return new WorkloadSpec(
                identity,
                spec.getServiceName(),
                selector,
                templates,
                spec.getReplicas() == null ? 1 : spec.getReplicas(),
                container == null ? null : container.getImage(),
                container == null ? null : toProbe(container.getReadinessProbe()),
                tree(statefulSet)
        );
    }

    public static LiveWorkloadState toLiveState(StatefulSet statefulSet, List<Pod> pods) {
        WorkloadSpec spec = toSpec(statefulSet, statefulSet.getMetadata().getNamespace());
        int ready = Optional.ofNullable(statefulSet.getStatus())
                .map(StatefulSetStatus::getReadyReplicas)
                .orElse(0);
        return new LiveWorkloadState(
                spec,
                ready,
                toPodStatuses(pods),
                statefulSet.getMetadata().getResourceVersion()
        );
    }

    public static StatefulSet toStatefulSet(WorkloadSpec spec) {
        if (spec.manifest() == null || !spec.manifest().isObject()) {
            throw new IllegalArgumentException("No declared manifest for " + spec.identity().key());
        }
        ObjectNode declared = spec.manifest().deepCopy();
        declared.remove("status");
        JsonNode metadataNode = declared.get("metadata");
        ObjectNode metadata = metadataNode instanceof ObjectNode ? (ObjectNode) metadataNode : declared.putObject("metadata");
        metadata.remove(List.of("resourceVersion", "uid", "creationTimestamp", "generation", "managedFields"));
        metadata.put("name", spec.identity().name());
        metadata.put("namespace", spec.identity().namespace());
        declared.put("apiVersion", "apps/v1");
        declared.put("kind", "StatefulSet");
        try {
            return Jsons.mapper().treeToValue(declared, StatefulSet.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Manifest for " + spec.identity().key() + " is not a StatefulSet", e);
        }
    }

    // terminating pods still count: they may hold the volume
    public static List<PodStatus> toPodStatuses(List<Pod> pods) {
        if (pods == null) {
            return List.of();
        }
        return pods.stream()
                .filter(pod -> pod.getMetadata() != null)
                .map(StatefulSetMapper::toPodStatus)
                .sorted(Comparator.comparing(PodStatus::name))
                .toList();
    }

    static boolean isReady(Pod pod) {
        if (pod.getStatus() == null || pod.getStatus().getConditions() == null) {
            return false;
        }
        for (PodCondition condition : pod.getStatus().getConditions()) {
            if ("Ready".equals(condition.getType())) {
                return "True".equals(condition.getStatus());
            }
        }
        return false;
    }

    private static PodStatus toPodStatus(Pod pod) {
        if (pod.getMetadata().getDeletionTimestamp() != null) {
            return new PodStatus(pod.getMetadata().getName(), TERMINATING, false);
        }
        String phase = pod.getStatus() == null ? null : pod.getStatus().getPhase();
        return new PodStatus(pod.getMetadata().getName(), phase == null ? "Unknown" : phase, isReady(pod));
    }

    private static VolumeClaimTemplate toTemplate(PersistentVolumeClaim claim) {
        String name = claim.getMetadata() == null ? null : claim.getMetadata().getName();
        PersistentVolumeClaimSpec spec = claim.getSpec();
        if (spec == null) {
            return new VolumeClaimTemplate(name, List.of(), null, null);
        }
        String storage = Optional.ofNullable(spec.getResources())
                .map(resources -> resources.getRequests())
                .map(requests -> requests.get("storage"))
                .map(Quantity::toString)
                .orElse(null);
        return new VolumeClaimTemplate(name, spec.getAccessModes(), spec.getStorageClassName(), storage);
    }

    private static Container firstContainer(PodTemplateSpec template) {
        return Optional.ofNullable(template)
                .map(PodTemplateSpec::getSpec)
                .map(PodSpec::getContainers)
                .filter(containers -> !containers.isEmpty())
                .map(containers -> containers.get(0))
                .orElse(null);
    }

    private static ReadinessProbe toProbe(Probe probe) {
        if (probe == null) {
            return null;
        }
        List<String> command = probe.getExec() == null ? List.of() : probe.getExec().getCommand();
        Integer port = probe.getTcpSocket() == null || probe.getTcpSocket().getPort() == null
                ? null
                : probe.getTcpSocket().getPort().getIntVal();
        return new ReadinessProbe(
                command,
                port,
                probe.getInitialDelaySeconds() == null ? 0 : probe.getInitialDelaySeconds(),
                probe.getPeriodSeconds() == null ? 10 : probe.getPeriodSeconds()
        );
    }

    private static JsonNode tree(StatefulSet statefulSet) {
        ObjectNode node = Jsons.mapper().valueToTree(statefulSet);
        node.remove("status");
        return node;
    }
}
