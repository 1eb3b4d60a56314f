package io.stsguard.kube;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.stsguard.cluster.ClusterSession;
import io.stsguard.cluster.ControlPlane;
import io.stsguard.cluster.DataStore;
import io.stsguard.cluster.VolumeArchiver;
import io.stsguard.config.GuardSettings;

public final class KubernetesBackend implements ClusterSession {
    private final KubernetesClient client;
    private final Fabric8ControlPlane controlPlane;
    private final PostgresExecDataStore dataStore;
    private final PodTarVolumeArchiver volumeArchiver;

    public KubernetesBackend(KubernetesClient client, GuardSettings settings) {
        this.client = client;
        this.controlPlane = new Fabric8ControlPlane(client);
        this.dataStore = new PostgresExecDataStore(client, settings);
        this.volumeArchiver = new PodTarVolumeArchiver(client, settings);
    }

    public static KubernetesBackend connect(String context, GuardSettings settings) {
        Config config = context == null || context.isBlank()
                ? Config.autoConfigure(null)
                : Config.autoConfigure(context.trim());
        return new KubernetesBackend(new KubernetesClientBuilder().withConfig(config).build(), settings);
    }

    @Override
    public ControlPlane controlPlane() {
        return controlPlane;
    }

    @Override
    public DataStore dataStore() {
        return dataStore;
    }

    @Override
    public VolumeArchiver volumeArchiver() {
        return volumeArchiver;
    }

    @Override
    public void close() {
        client.close();
    }
}
