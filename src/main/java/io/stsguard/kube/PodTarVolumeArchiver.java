package io.stsguard.kube;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.stsguard.cluster.DataStoreUnreachableException;
import io.stsguard.cluster.VolumeArchiver;
import io.stsguard.config.GuardSettings;
import io.stsguard.model.WorkloadIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PodTarVolumeArchiver implements VolumeArchiver {
    private static final Logger LOGGER = LoggerFactory.getLogger(PodTarVolumeArchiver.class);
    private static final String ARCHIVE_FILE = "/tmp/stsguard-restore.tar.gz";

    private final PodExec exec;
    private final String dataDir;

    public PodTarVolumeArchiver(KubernetesClient client, GuardSettings settings) {
        this.exec = new PodExec(client, settings.pgContainer(), settings.execTimeoutMs());
        this.dataDir = settings.pgDataDir();
    }

    @Override
    public byte[] archive(WorkloadIdentity identity) {
        Pod pod = exec.targetPod(identity, false);
        PodExec.Result result = exec.run(identity, pod, "tar", "czf", "-", "-C", dataDir, ".");
        if (result.exitStatus() != 0) {
            throw new DataStoreUnreachableException("tar of " + dataDir + " in " + pod.getMetadata().getName()
                    + " exited " + result.exitStatus() + ": " + result.stderr().trim());
        }
        LOGGER.info("Archived {} of {} ({} bytes)", dataDir, identity.key(), result.stdout().length);
        return result.stdout();
    }

    @Override
    public int extract(WorkloadIdentity identity, byte[] archive) {
        Pod pod = exec.targetPod(identity, false);
        exec.upload(identity, pod, ARCHIVE_FILE, archive);
        PodExec.Result result = exec.run(identity, pod, "sh", "-c",
                "tar xzf " + ARCHIVE_FILE + " -C '" + dataDir + "' && rm -f " + ARCHIVE_FILE);
        if (result.exitStatus() != 0) {
            LOGGER.warn("Extracting archive into {} exited {}: {}", identity.key(), result.exitStatus(), result.stderr().trim());
        }
        return result.exitStatus();
    }
}
