package io.stsguard.kube;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.stsguard.cluster.DataStore;
import io.stsguard.cluster.DataStoreUnreachableException;
import io.stsguard.cluster.DumpResult;
import io.stsguard.config.GuardSettings;
import io.stsguard.model.WorkloadIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PostgresExecDataStore implements DataStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresExecDataStore.class);
    private static final String RESTORE_FILE = "/tmp/stsguard-restore.sql";

    private final PodExec exec;
    private final String user;
    private final String database;

    public PostgresExecDataStore(KubernetesClient client, GuardSettings settings) {
        this.exec = new PodExec(client, settings.pgContainer(), settings.execTimeoutMs());
        this.user = settings.pgUser();
        this.database = settings.pgDatabase();
    }

    @Override
    public DumpResult dump(WorkloadIdentity identity) {
        Pod pod = exec.targetPod(identity, true);
        PodExec.Result result = exec.run(identity, pod,
                "pg_dump", "-U", user, "-d", database, "--clean", "--if-exists", "--create");
        LOGGER.info("pg_dump of {} in {} exited {} with {} bytes", identity.key(),
                pod.getMetadata().getName(), result.exitStatus(), result.stdout().length);
        return new DumpResult(result.stdout(), result.exitStatus(), result.stderr());
    }

    // the dump recreates its own database, so connect to the maintenance one
    @Override
    public int restore(WorkloadIdentity identity, byte[] dump) {
        Pod pod = exec.targetPod(identity, true);
        exec.upload(identity, pod, RESTORE_FILE, dump);
        PodExec.Result result = exec.run(identity, pod, "psql", "-U", user, "-d", "postgres", "-f", RESTORE_FILE);
        if (result.exitStatus() != 0) {
            LOGGER.warn("psql import into {} exited {}: {}", identity.key(), result.exitStatus(), result.stderr().trim());
        }
        PodExec.Result cleanup = exec.run(identity, pod, "rm", "-f", RESTORE_FILE);
        if (cleanup.exitStatus() != 0) {
            LOGGER.warn("Could not remove {} from {}: {}", RESTORE_FILE, pod.getMetadata().getName(), cleanup.stderr().trim());
        }
        return result.exitStatus();
    }

    @Override
    public boolean isReady(WorkloadIdentity identity) {
        try {
            Pod pod = exec.targetPod(identity, true);
            return exec.run(identity, pod, "pg_isready", "-U", user, "-d", database).exitStatus() == 0;
        } catch (DataStoreUnreachableException e) {
            LOGGER.debug("{} not accepting connections: {}", identity.key(), e.getMessage());
            return false;
        }
    }
}
