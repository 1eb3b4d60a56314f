package io.stsguard.kube;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.api.model.StatusCause;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import io.fabric8.kubernetes.api.model.apps.StatefulSetPersistentVolumeClaimRetentionPolicy;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.RollableScalableResource;
import io.stsguard.cluster.ApplyConflictException;
import io.stsguard.cluster.ControlPlane;
import io.stsguard.cluster.ControlPlaneException;
import io.stsguard.cluster.RejectedException;
import io.stsguard.cluster.RejectedImmutableFieldException;
import io.stsguard.cluster.TransportException;
import io.stsguard.model.LiveWorkloadState;
import io.stsguard.model.PodStatus;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.model.WorkloadSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

public class Fabric8ControlPlane implements ControlPlane {
    private static final Logger LOGGER = LoggerFactory.getLogger(Fabric8ControlPlane.class);

    private static final Set<String> IMMUTABLE_INVALID_FIELDS = Set.of(
            "spec.selector",
            "spec.serviceName",
            "spec.volumeClaimTemplates"
    );

    private final KubernetesClient client;

    public Fabric8ControlPlane(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<LiveWorkloadState> get(WorkloadIdentity identity) {
        return call("read", identity, () -> {
            StatefulSet current = statefulSet(identity).get();
            if (current == null) {
                return Optional.empty();
            }
            return Optional.of(StatefulSetMapper.toLiveState(current, pods(identity, current)));
        });
    }

    @Override
    public void apply(WorkloadSpec spec) {
        WorkloadIdentity identity = spec.identity();
        StatefulSet desired = StatefulSetMapper.toStatefulSet(spec);
        call("apply", identity, () -> {
            StatefulSet current = statefulSet(identity).get();
            if (current == null) {
                client.apps().statefulSets().inNamespace(identity.namespace()).resource(desired).create();
                LOGGER.info("Created StatefulSet {}", identity.key());
            } else {
                desired.getMetadata().setResourceVersion(current.getMetadata().getResourceVersion());
                client.apps().statefulSets().inNamespace(identity.namespace()).resource(desired).update();
                LOGGER.info("Updated StatefulSet {} from resourceVersion {}", identity.key(),
                        current.getMetadata().getResourceVersion());
            }
            return null;
        });
    }

    @Override
    public void delete(WorkloadIdentity identity, boolean keepStorage) {
        call("delete", identity, () -> {
            StatefulSet current = statefulSet(identity).get();
            if (current == null) {
                LOGGER.info("StatefulSet {} already absent", identity.key());
                return null;
            }
            if (keepStorage) {
                retainClaims(identity, current);
            }
            statefulSet(identity).withPropagationPolicy(DeletionPropagation.BACKGROUND).delete();
            LOGGER.info("Deleted StatefulSet {} (storage claims {})", identity.key(), keepStorage ? "kept" : "not guarded");
            return null;
        });
    }

    @Override
    public void scale(WorkloadIdentity identity, int replicas) {
        call("scale", identity, () -> {
            statefulSet(identity).edit(current -> new StatefulSetBuilder(current)
                    .editSpec()
                    .withReplicas(replicas)
                    .endSpec()
                    .build());
            LOGGER.info("Scaled StatefulSet {} to {} replica(s)", identity.key(), replicas);
            return null;
        });
    }

    @Override
    public List<PodStatus> listPods(WorkloadIdentity identity) {
        return call("list pods of", identity, () -> {
            StatefulSet current = statefulSet(identity).get();
            if (current == null) {
                return List.of();
            }
            return StatefulSetMapper.toPodStatuses(pods(identity, current));
        });
    }

    private RollableScalableResource<StatefulSet> statefulSet(WorkloadIdentity identity) {
        return client.apps().statefulSets().inNamespace(identity.namespace()).withName(identity.name());
    }

    List<Pod> pods(WorkloadIdentity identity, StatefulSet statefulSet) {
        Map<String, String> selector = Optional.ofNullable(statefulSet.getSpec())
                .map(spec -> spec.getSelector())
                .map(LabelSelector::getMatchLabels)
                .orElse(Map.of());
        if (selector.isEmpty()) {
            return List.of();
        }
        return client.pods().inNamespace(identity.namespace()).withLabels(selector).list().getItems();
    }

    // whenDeleted: Delete would take the volumes with the object
    private void retainClaims(WorkloadIdentity identity, StatefulSet current) {
        StatefulSetPersistentVolumeClaimRetentionPolicy policy = current.getSpec() == null
                ? null
                : current.getSpec().getPersistentVolumeClaimRetentionPolicy();
        if (policy == null || !"Delete".equals(policy.getWhenDeleted())) {
            return;
        }
        statefulSet(identity).edit(sts -> new StatefulSetBuilder(sts)
                .editSpec()
                .editPersistentVolumeClaimRetentionPolicy()
                .withWhenDeleted("Retain")
                .endPersistentVolumeClaimRetentionPolicy()
                .endSpec()
                .build());
        LOGGER.info("Switched claim retention of {} to Retain before delete", identity.key());
    }

    private <T> T call(String action, WorkloadIdentity identity, Supplier<T> body) {
        try {
            return body.get();
        } catch (KubernetesClientException e) {
            ControlPlaneException translated = translate(action, identity, e);
            LOGGER.warn("{}", translated.getMessage());
            throw translated;
        }
    }

    static ControlPlaneException translate(String action, WorkloadIdentity identity, KubernetesClientException e) {
        int code = e.getCode();
        String message = "Failed to " + action + " " + identity.key() + " (HTTP " + code + "): " + reason(e);
        if (code <= 0 || code == 429 || code >= 500) {
            return new TransportException(message, e);
        }
        if (code == 409) {
            return new ApplyConflictException(message, e);
        }
        if (code == 422) {
            List<String> immutable = immutableFields(e.getStatus());
            if (!immutable.isEmpty()) {
                return new RejectedImmutableFieldException(message, immutable, e);
            }
        }
        return new RejectedException(code, message, e);
    }

    private static List<String> immutableFields(Status status) {
        if (status == null || status.getDetails() == null || status.getDetails().getCauses() == null) {
            return List.of();
        }
        List<String> fields = new ArrayList<>();
        for (StatusCause cause : status.getDetails().getCauses()) {
            String field = cause.getField() == null ? "" : cause.getField();
            boolean underSpec = field.equals("spec") || field.startsWith("spec.");
            if ("FieldValueForbidden".equals(cause.getReason()) && underSpec) {
                fields.add(field);
            } else if ("FieldValueInvalid".equals(cause.getReason()) && isProtectedPath(field)) {
                fields.add(field);
            }
        }
        return fields;
    }

    private static boolean isProtectedPath(String field) {
        for (String path : IMMUTABLE_INVALID_FIELDS) {
            if (field.equals(path) || field.startsWith(path + ".") || field.startsWith(path + "[")) {
                return true;
            }
        }
        return false;
    }

    private static String reason(KubernetesClientException e) {
        if (e.getStatus() != null && e.getStatus().getMessage() != null) {
            return e.getStatus().getMessage();
        }
        return e.getMessage();
    }
}
