package io.stsguard.runtime;

import io.stsguard.cluster.RejectedException;
import io.stsguard.config.GuardSettings;
import io.stsguard.config.StsGuardConfig;
import io.stsguard.model.ApplyPath;
import io.stsguard.model.ArtifactKind;
import io.stsguard.model.BackupArtifact;
import io.stsguard.model.ErrorKind;
import io.stsguard.model.FieldChange;
import io.stsguard.model.FieldDiff;
import io.stsguard.model.OperationMode;
import io.stsguard.model.OperationRecord;
import io.stsguard.model.Outcome;
import io.stsguard.model.Phase;
import io.stsguard.model.PhaseMark;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.model.WorkloadSpec;
import io.stsguard.storage.BackupArtifactStore;
import io.stsguard.storage.OperationStore;
import io.stsguard.support.FakeControlPlane;
import io.stsguard.support.FakeDataStore;
import io.stsguard.support.FakeVolumeArchiver;
import io.stsguard.support.ManualTicker;
import io.stsguard.support.Workloads;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class SafeApplyOrchestratorTest {
    private static final WorkloadIdentity PG = Workloads.PG;

    @Test
    void replicaChangeTakesFastPathWithoutBackup() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-fast-path-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("standard", "10Gi", 3), true);

            Assertions.assertEquals(Outcome.SUCCEEDED, record.outcome());
            Assertions.assertEquals(ApplyPath.FAST, record.path());
            Assertions.assertEquals(
                    List.of(Phase.IDLE, Phase.DIFFING, Phase.FAST_APPLYING, Phase.VERIFYING, Phase.SUCCEEDED),
                    phases(record));
            Assertions.assertEquals(1L, controlPlane.count("apply"));
            Assertions.assertEquals(0L, controlPlane.count("scale"));
            Assertions.assertEquals(0L, controlPlane.count("delete"));
            Assertions.assertEquals(0L, dataStore.count("dump"));
            Assertions.assertEquals(0L, dataStore.count("restore"));
            Assertions.assertTrue(orchestrator.artifacts(PG).isEmpty());
            Assertions.assertEquals(3, controlPlane.readyReplicas(PG));
            Assertions.assertNull(record.artifact());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storageClassChangeRecreatesWithBackupBeforeDelete() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-recreate-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

            Assertions.assertEquals(Outcome.SUCCEEDED, record.outcome());
            Assertions.assertEquals(ApplyPath.RECREATE, record.path());
            Assertions.assertEquals(List.of(
                    Phase.IDLE,
                    Phase.DIFFING,
                    Phase.BACKING_UP,
                    Phase.SCALING_DOWN,
                    Phase.DELETING,
                    Phase.RECREATING,
                    Phase.RESTORING,
                    Phase.VERIFYING,
                    Phase.SUCCEEDED
            ), phases(record));
            Assertions.assertTrue(record.diff().changes().stream()
                    .map(FieldChange::fieldPath)
                    .anyMatch(path -> path.endsWith("storageClassName")));

            int dump = journal.indexOf("dump db/pg");
            int scale = journal.indexOf("scale db/pg 0");
            int delete = journal.indexOf("delete db/pg keepStorage=true");
            int restore = journal.indexOf("restore db/pg");
            Assertions.assertTrue(dump >= 0 && dump < scale, journal.toString());
            Assertions.assertTrue(scale < delete, journal.toString());
            Assertions.assertTrue(journal.lastIndexOf("apply db/pg") > delete, journal.toString());
            Assertions.assertTrue(restore > journal.lastIndexOf("apply db/pg"), journal.toString());

            List<BackupArtifactStore.ArtifactEntry> artifacts = orchestrator.artifacts(PG);
            Assertions.assertEquals(1, artifacts.size());
            Assertions.assertEquals(record.artifact(), artifacts.get(0).artifact());
            Assertions.assertEquals(ArtifactKind.LOGICAL_DUMP, artifacts.get(0).artifact().kind());
            Assertions.assertNotNull(artifacts.get(0).consumedAt());
            Assertions.assertEquals(record.operationId(), artifacts.get(0).consumedBy());
            Assertions.assertEquals(1L, dataStore.count("restore"));

            WorkloadSpec live = controlPlane.current(PG).orElseThrow();
            Assertions.assertEquals("premium", live.volumeClaimTemplates().get(0).storageClassName());
            Assertions.assertArrayEquals(Workloads.sampleDump(), dataStore.contents(PG));
            Assertions.assertTrue(dataStore.isReady(PG));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedDumpLeavesLiveWorkloadUntouched() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-dump-fails-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            WorkloadSpec before = Workloads.postgres("standard", "10Gi", 1);
            controlPlane.seed(before, 1);
            dataStore.put(PG, Workloads.sampleDump());
            dataStore.dumpFails(1, "pg_dump: error: connection to server failed: FATAL: role \"postgres\" does not exist");
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

            Assertions.assertEquals(Outcome.FAILED, record.outcome());
            Assertions.assertEquals(Phase.BACKING_UP, record.phaseReached());
            Assertions.assertTrue(record.hasIssue(ErrorKind.BACKUP_FAILED));
            Assertions.assertEquals(0L, controlPlane.count("scale"));
            Assertions.assertEquals(0L, controlPlane.count("delete"));
            Assertions.assertEquals(0L, controlPlane.count("apply"));
            Assertions.assertEquals(before, controlPlane.current(PG).orElseThrow());
            Assertions.assertTrue(orchestrator.artifacts(PG).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void undersizedDumpIsDiscardedAndRunFails() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-small-dump-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            dataStore.put(PG, "--\n".getBytes(StandardCharsets.UTF_8));
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

            Assertions.assertEquals(Outcome.FAILED, record.outcome());
            Assertions.assertTrue(record.hasIssue(ErrorKind.BACKUP_FAILED));
            Assertions.assertEquals(0L, controlPlane.count("delete"));
            Assertions.assertTrue(orchestrator.artifacts(PG).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void replicaThatNeverBecomesReadyEndsDegradedAtVerifying() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-never-ready-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            controlPlane.becomesReady(false);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

            Assertions.assertEquals(Outcome.DEGRADED, record.outcome());
            Assertions.assertEquals(Phase.VERIFYING, record.phaseReached());
            Assertions.assertTrue(record.hasIssue(ErrorKind.VERIFICATION_TIMEOUT));
            Assertions.assertFalse(phases(record).contains(Phase.RESTORING));
            Assertions.assertEquals(0L, dataStore.count("restore"));
            Assertions.assertNotNull(record.artifact());
            Assertions.assertNull(orchestrator.artifacts(PG).get(0).consumedAt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedRestoreEndsDegradedNotFailed() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-restore-partial-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            dataStore.put(PG, Workloads.sampleDump());
            dataStore.restoreExitStatus(3);
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

            Assertions.assertEquals(Outcome.DEGRADED, record.outcome());
            Assertions.assertEquals(Phase.VERIFYING, record.phaseReached());
            Assertions.assertTrue(record.hasIssue(ErrorKind.RESTORE_PARTIAL));
            Assertions.assertTrue(controlPlane.current(PG).isPresent());
            Assertions.assertNull(orchestrator.artifacts(PG).get(0).consumedAt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void repeatedApplyOfSameSpecStaysOnFastPath() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-idempotent-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            WorkloadSpec desired = Workloads.postgres("standard", "10Gi", 2);
            controlPlane.seed(desired, 2);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord first = orchestrator.safeApply(desired, true);
            OperationRecord second = orchestrator.safeApply(desired, true);

            Assertions.assertEquals(ApplyPath.FAST, first.path());
            Assertions.assertEquals(ApplyPath.FAST, second.path());
            Assertions.assertEquals(Outcome.SUCCEEDED, second.outcome());
            Assertions.assertEquals(0L, dataStore.count("dump"));
            Assertions.assertTrue(orchestrator.artifacts(PG).isEmpty());
            Assertions.assertEquals(2, orchestrator.history(PG, 10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void heldIdentityReturnsBusyWithoutTouchingCluster() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-busy-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);
            IdentityLocks otherProcess = new IdentityLocks(StsGuardConfig.fromRoot(root.toString()));

            try (IdentityLocks.Lease lease = otherProcess.tryAcquire(PG).orElseThrow()) {
                OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

                Assertions.assertEquals(Outcome.BUSY, record.outcome());
                Assertions.assertEquals(PG, lease.identity());
            }
            Assertions.assertTrue(journal.isEmpty(), journal.toString());
            Assertions.assertEquals(0, controlPlane.getCalls());
            Assertions.assertTrue(orchestrator.history(PG, 10).isEmpty());

            OperationRecord afterRelease = orchestrator.safeApply(Workloads.postgres("standard", "10Gi", 1), true);
            Assertions.assertEquals(Outcome.SUCCEEDED, afterRelease.outcome());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void incompletePriorRunIsReportedAndNotRestoredFrom() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-prior-run-");
        try {
            StsGuardConfig config = StsGuardConfig.fromRoot(root.toString());
            Instant priorStart = Instant.ofEpochMilli(ManualTicker.EPOCH_MS - 60_000L);
            BackupArtifact leftOver = new BackupArtifactStore(config)
                    .write(PG, ArtifactKind.LOGICAL_DUMP, Workloads.sampleDump(), priorStart);
            OperationRecord prior = new OperationRecord(
                    "prior-run",
                    PG,
                    OperationMode.SAFE_APPLY,
                    ApplyPath.RECREATE,
                    true,
                    List.of(
                            new PhaseMark(Phase.IDLE, priorStart, null),
                            new PhaseMark(Phase.DELETING, priorStart, null)
                    ),
                    Phase.DELETING,
                    null,
                    List.of(),
                    FieldDiff.update(List.of()),
                    leftOver,
                    null,
                    priorStart,
                    null
            );
            new OperationStore(config).save(prior);

            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

            Assertions.assertEquals(Outcome.SUCCEEDED, record.outcome());
            Assertions.assertEquals(ApplyPath.CREATE, record.path());
            Assertions.assertEquals("prior-run", record.resumedFrom());
            Assertions.assertTrue(record.hasIssue(ErrorKind.INCOMPLETE_PRIOR_RUN));
            Assertions.assertTrue(record.issues().get(0).message().contains(leftOver.artifactId()));
            Assertions.assertEquals(0L, dataStore.count("restore"));
            Assertions.assertNull(orchestrator.artifacts(PG).get(0).consumedAt());
            Assertions.assertEquals(record.operationId(), orchestrator.history(PG, 1).get(0).operationId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void disabledBackupIsRecordedAndSkipsRestore() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-no-backup-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), false);

            Assertions.assertEquals(Outcome.SUCCEEDED, record.outcome());
            Assertions.assertTrue(record.hasIssue(ErrorKind.BACKUP_DISABLED));
            Assertions.assertFalse(phases(record).contains(Phase.BACKING_UP));
            Assertions.assertFalse(phases(record).contains(Phase.RESTORING));
            Assertions.assertEquals(0L, dataStore.count("dump"));
            Assertions.assertEquals(1L, controlPlane.count("delete"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void immutableRejectionOnInPlaceApplyEscalatesToRecreate() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-escalate-");
        try {
            Files.writeString(root.resolve(StsGuardConfig.SETTINGS_FILE),
                    "{\"protectedFields\":[\"selector\",\"volumeClaimTemplates\"]}", StandardCharsets.UTF_8);
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres(PG, "pg-headless", "standard", "10Gi", 1), 1);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(
                    Workloads.postgres(PG, "pg-internal", "standard", "10Gi", 1), true);

            Assertions.assertEquals(Outcome.SUCCEEDED, record.outcome());
            Assertions.assertEquals(ApplyPath.RECREATE, record.path());
            Assertions.assertTrue(record.hasIssue(ErrorKind.REJECTED_IMMUTABLE_FIELD));
            Assertions.assertEquals(Phase.FAST_APPLYING, phases(record).get(2));
            Assertions.assertEquals(Phase.BACKING_UP, phases(record).get(3));
            Assertions.assertTrue(record.diff().changes().stream().anyMatch(c -> c.fieldPath().equals("spec")));
            Assertions.assertEquals("pg-internal", controlPlane.current(PG).orElseThrow().serviceName());
            Assertions.assertNotNull(orchestrator.artifacts(PG).get(0).consumedAt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void otherRejectionOnInPlaceApplyFails() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-fast-rejected-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            controlPlane.failApplies(new RejectedException(403,
                    "statefulsets.apps \"pg\" is forbidden: User cannot update resource", null));
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("standard", "10Gi", 2), true);

            Assertions.assertEquals(Outcome.FAILED, record.outcome());
            Assertions.assertEquals(Phase.FAST_APPLYING, record.phaseReached());
            Assertions.assertTrue(record.hasIssue(ErrorKind.REJECTED));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lingeringPodsAreToleratedDuringScaleDown() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-termination-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            controlPlane.podsLinger(true);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

            Assertions.assertEquals(Outcome.SUCCEEDED, record.outcome());
            Assertions.assertTrue(record.hasIssue(ErrorKind.TERMINATION_TIMEOUT));
            Assertions.assertEquals(1L, controlPlane.count("delete"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void objectThatWillNotGoAwayStopsBeforeRecreate() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-delete-stuck-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            controlPlane.deleteStuck(true);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

            Assertions.assertEquals(Outcome.DEGRADED, record.outcome());
            Assertions.assertEquals(Phase.DELETING, record.phaseReached());
            Assertions.assertTrue(record.hasIssue(ErrorKind.DELETE_TIMEOUT));
            Assertions.assertEquals(0L, controlPlane.count("apply"));
            Assertions.assertNotNull(record.artifact());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void forceRecreateIgnoresEmptyDiff() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-force-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            WorkloadSpec desired = Workloads.postgres("standard", "10Gi", 1);
            controlPlane.seed(desired, 1);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.forceRecreate(desired, true);

            Assertions.assertEquals(OperationMode.FORCE_RECREATE, record.mode());
            Assertions.assertEquals(ApplyPath.RECREATE, record.path());
            Assertions.assertEquals(Outcome.SUCCEEDED, record.outcome());
            Assertions.assertTrue(record.diff().isEmpty());
            Assertions.assertEquals(1L, dataStore.count("dump"));
            Assertions.assertEquals(1L, dataStore.count("restore"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void forceRecreateOfAbsentWorkloadCreatesIt() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-force-create-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.forceRecreate(Workloads.postgres("standard", "10Gi", 1), true);

            Assertions.assertEquals(ApplyPath.CREATE, record.path());
            Assertions.assertEquals(Outcome.SUCCEEDED, record.outcome());
            Assertions.assertEquals(FieldDiff.Kind.CREATE, record.diff().kind());
            Assertions.assertEquals(0L, dataStore.count("dump"));
            Assertions.assertEquals(0L, controlPlane.count("delete"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void transportErrorIsRetriedOnceThenFails() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-transport-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            controlPlane.failNextGets(1);
            OperationRecord retried = orchestrator.safeApply(Workloads.postgres("standard", "10Gi", 1), true);
            Assertions.assertEquals(Outcome.SUCCEEDED, retried.outcome());

            controlPlane.failNextGets(2);
            OperationRecord failed = orchestrator.safeApply(Workloads.postgres("standard", "10Gi", 1), true);
            Assertions.assertEquals(Outcome.FAILED, failed.outcome());
            Assertions.assertEquals(Phase.DIFFING, failed.phaseReached());
            Assertions.assertTrue(failed.hasIssue(ErrorKind.TRANSPORT_ERROR));
            Assertions.assertEquals(1L, controlPlane.count("apply"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleVersionConflictIsRetriedOnce() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-conflict-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            controlPlane.conflictOnNextApplies(1);
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("standard", "10Gi", 2), true);

            Assertions.assertEquals(Outcome.SUCCEEDED, record.outcome());
            Assertions.assertEquals(2L, controlPlane.count("apply"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recordsAndAuditTrailArePersisted() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-persisted-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            OperationRecord record = orchestrator.safeApply(Workloads.postgres("premium", "10Gi", 1), true);

            OperationStore store = new OperationStore(StsGuardConfig.fromRoot(root.toString()));
            OperationRecord persisted = store.find(PG, record.operationId()).orElseThrow();
            Assertions.assertEquals(record.outcome(), persisted.outcome());
            Assertions.assertEquals(record.phases(), persisted.phases());
            Assertions.assertEquals(record.artifact(), persisted.artifact());
            Assertions.assertEquals(record.finishedAt(), persisted.finishedAt());
            Assertions.assertTrue(persisted.finished());
            try (Stream<Path> files = Files.list(root.resolve("db").resolve("pg").resolve("operations"))) {
                List<String> names = files.map(p -> p.getFileName().toString()).toList();
                Assertions.assertEquals(1, names.size());
                Assertions.assertTrue(names.get(0).matches("\\d{8}T\\d{9}Z-" + record.operationId() + "\\.json"), names.toString());
            }
            int rows = orchestrator.auditLogger().verify();
            Assertions.assertTrue(rows >= phases(record).size(), "audit rows: " + rows);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void diffCheckIsReadOnly() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-diff-check-");
        try {
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            FieldDiff same = orchestrator.diffCheck(PG, Workloads.postgres("standard", "20Gi", 3));
            FieldDiff changed = orchestrator.diffCheck(PG, Workloads.postgres("premium", "10Gi", 1));
            FieldDiff absent = orchestrator.diffCheck(WorkloadIdentity.of("db", "other"),
                    Workloads.postgres(WorkloadIdentity.of("db", "other"), "other", "standard", "1Gi", 1));

            Assertions.assertTrue(same.isEmpty());
            Assertions.assertFalse(changed.isEmpty());
            Assertions.assertEquals(FieldDiff.Kind.CREATE, absent.kind());
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> orchestrator.diffCheck(WorkloadIdentity.of("db", "other"), Workloads.postgres("standard", "10Gi", 1)));
            Assertions.assertTrue(journal.isEmpty(), journal.toString());
            Assertions.assertTrue(orchestrator.history(PG, 10).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runsForDifferentWorkloadsShareOneAuditChain() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-shared-audit-");
        try {
            WorkloadIdentity other = WorkloadIdentity.of("db", "other");
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            controlPlane.seed(Workloads.postgres(other, "other-headless", "standard", "10Gi", 1), 1);
            SafeApplyOrchestrator first = orchestrator(root, controlPlane, dataStore);
            SafeApplyOrchestrator second = orchestrator(root, controlPlane, dataStore);

            OperationRecord pg = first.safeApply(Workloads.postgres("standard", "10Gi", 2), true);
            OperationRecord rest = second.safeApply(
                    Workloads.postgres(other, "other-headless", "standard", "10Gi", 2), true);
            OperationRecord pgAgain = first.safeApply(Workloads.postgres("standard", "10Gi", 3), true);

            Assertions.assertEquals(Outcome.SUCCEEDED, pg.outcome());
            Assertions.assertEquals(Outcome.SUCCEEDED, rest.outcome());
            Assertions.assertEquals(Outcome.SUCCEEDED, pgAgain.outcome());
            int rows = first.auditLogger().verify();
            Assertions.assertTrue(rows >= phases(pg).size() + phases(rest).size() + phases(pgAgain).size(),
                    "audit rows: " + rows);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void standaloneRestoreRefusesVolumeArchive() throws Exception {
        Path root = Files.createTempDirectory("stsguard-test-restore-archive-");
        try {
            StsGuardConfig config = StsGuardConfig.fromRoot(root.toString());
            BackupArtifact archive = new BackupArtifactStore(config).write(
                    PG, ArtifactKind.VOLUME_ARCHIVE, new byte[256], Instant.ofEpochMilli(ManualTicker.EPOCH_MS));
            List<String> journal = new ArrayList<>();
            FakeControlPlane controlPlane = new FakeControlPlane(journal);
            FakeDataStore dataStore = new FakeDataStore(journal);
            controlPlane.seed(Workloads.postgres("standard", "10Gi", 1), 1);
            dataStore.put(PG, Workloads.sampleDump());
            SafeApplyOrchestrator orchestrator = orchestrator(root, controlPlane, dataStore);

            IllegalArgumentException thrown = Assertions.assertThrows(IllegalArgumentException.class,
                    () -> orchestrator.restoreNow(PG, archive.artifactId()));

            Assertions.assertTrue(thrown.getMessage().contains("volume archive"), thrown.getMessage());
            Assertions.assertFalse(journal.stream().anyMatch(entry -> entry.startsWith("extract")), journal.toString());
            Assertions.assertNull(orchestrator.artifacts(PG).get(0).consumedAt());
        } finally {
            deleteRecursively(root);
        }
    }

    private static SafeApplyOrchestrator orchestrator(Path root, FakeControlPlane controlPlane, FakeDataStore dataStore) {
        StsGuardConfig config = StsGuardConfig.fromRoot(root.toString());
        return new SafeApplyOrchestrator(
                config,
                GuardSettings.load(config.settingsFile()),
                controlPlane,
                dataStore,
                new FakeVolumeArchiver(controlPlane.journal()),
                new ManualTicker()
        );
    }

    private static List<Phase> phases(OperationRecord record) {
        return record.phases().stream().map(PhaseMark::phase).toList();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
