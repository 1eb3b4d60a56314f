package io.stsguard.kube;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.ContainerResource;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import io.stsguard.cluster.DataStoreUnreachableException;
import io.stsguard.model.WorkloadIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

final class PodExec {
    private static final Logger LOGGER = LoggerFactory.getLogger(PodExec.class);

    private final KubernetesClient client;
    private final String containerName;
    private final long timeoutMs;

    PodExec(KubernetesClient client, String containerName, long timeoutMs) {
        this.client = client;
        this.containerName = containerName == null ? "" : containerName.trim();
        this.timeoutMs = timeoutMs;
    }

    record Result(int exitStatus, byte[] stdout, String stderr) {
    }

    Pod targetPod(WorkloadIdentity identity, boolean requireReady) {
        List<Pod> pods;
        try {
            StatefulSet statefulSet = client.apps().statefulSets()
                    .inNamespace(identity.namespace())
                    .withName(identity.name())
                    .get();
            if (statefulSet == null || statefulSet.getSpec() == null || statefulSet.getSpec().getSelector() == null
                    || statefulSet.getSpec().getSelector().getMatchLabels() == null) {
                throw new DataStoreUnreachableException("No StatefulSet " + identity.key() + " to exec into");
            }
            pods = client.pods()
                    .inNamespace(identity.namespace())
                    .withLabels(statefulSet.getSpec().getSelector().getMatchLabels())
                    .list()
                    .getItems();
        } catch (KubernetesClientException e) {
            throw new DataStoreUnreachableException("Failed to list pods of " + identity.key(), e);
        }
        return pods.stream()
                .filter(pod -> pod.getMetadata() != null && pod.getMetadata().getDeletionTimestamp() == null)
                .filter(pod -> requireReady
                        ? StatefulSetMapper.isReady(pod)
                        : pod.getStatus() != null && "Running".equals(pod.getStatus().getPhase()))
                .min(Comparator.comparing(pod -> pod.getMetadata().getName()))
                .orElseThrow(() -> new DataStoreUnreachableException(
                        "No " + (requireReady ? "ready" : "running") + " pod for " + identity.key()));
    }

    Result run(WorkloadIdentity identity, Pod pod, String... command) {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        String podName = pod.getMetadata().getName();
        LOGGER.debug("exec in {}/{}: {}", identity.namespace(), podName, command[0]);
        try (ExecWatch watch = container(identity, pod)
                .writingOutput(stdout)
                .writingError(stderr)
                .exec(command)) {
            Integer exit = watch.exitCode().get(timeoutMs, TimeUnit.MILLISECONDS);
            return new Result(exit == null ? -1 : exit, stdout.toByteArray(), stderr.toString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataStoreUnreachableException("Interrupted while running " + command[0] + " in " + podName, e);
        } catch (ExecutionException | TimeoutException | KubernetesClientException e) {
            throw new DataStoreUnreachableException("Failed to run " + command[0] + " in " + podName, e);
        }
    }

    void upload(WorkloadIdentity identity, Pod pod, String remotePath, byte[] payload) {
        boolean copied;
        try {
            copied = container(identity, pod).file(remotePath).upload(new ByteArrayInputStream(payload));
        } catch (KubernetesClientException e) {
            throw new DataStoreUnreachableException("Failed to upload " + remotePath + " to " + pod.getMetadata().getName(), e);
        }
        if (!copied) {
            throw new DataStoreUnreachableException("Upload of " + remotePath + " to " + pod.getMetadata().getName() + " failed");
        }
    }

    private ContainerResource container(WorkloadIdentity identity, Pod pod) {
        return client.pods()
                .inNamespace(identity.namespace())
                .withName(pod.getMetadata().getName())
                .inContainer(resolveContainer(pod));
    }

    private String resolveContainer(Pod pod) {
        if (!containerName.isEmpty()) {
            return containerName;
        }
        List<Container> containers = pod.getSpec() == null ? List.of() : pod.getSpec().getContainers();
        if (containers == null || containers.isEmpty()) {
            throw new DataStoreUnreachableException("Pod " + pod.getMetadata().getName() + " has no containers");
        }
        return containers.get(0).getName();
    }
}
