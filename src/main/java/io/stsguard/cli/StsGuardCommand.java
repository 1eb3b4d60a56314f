package io.stsguard.cli;

import io.stsguard.backup.BackupFailedException;
import io.stsguard.cluster.ClusterSession;
import io.stsguard.cluster.ControlPlaneException;
import io.stsguard.config.GuardSettings;
import io.stsguard.config.StsGuardConfig;
import io.stsguard.kube.InvalidManifestException;
import io.stsguard.kube.KubernetesBackend;
import io.stsguard.kube.ManifestLoader;
import io.stsguard.model.BackupArtifact;
import io.stsguard.model.FieldDiff;
import io.stsguard.model.OperationRecord;
import io.stsguard.model.Outcome;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.model.WorkloadSpec;
import io.stsguard.restore.RestoreResult;
import io.stsguard.runtime.IdentityBusyException;
import io.stsguard.runtime.SafeApplyOrchestrator;
import io.stsguard.util.Jsons;
import io.stsguard.util.Ticker;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
        name = "stsguard",
        mixinStandardHelpOptions = true,
        description = "Safe apply of StatefulSet manifests with backup, recreate and restore",
        exitCodeOnInvalidInput = StsGuardCommand.EXIT_INVALID_INPUT,
        exitCodeOnExecutionException = StsGuardCommand.EXIT_REJECTED,
        subcommands = {
                StsGuardCommand.SafeApplyCommand.class,
                StsGuardCommand.DiffCheckCommand.class,
                StsGuardCommand.ForceRecreateCommand.class,
                StsGuardCommand.BackupCommand.class,
                StsGuardCommand.RestoreCommand.class,
                StsGuardCommand.HistoryCommand.class
        }
)
public final class StsGuardCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_DEGRADED = 1;
    static final int EXIT_REJECTED = 2;
    static final int EXIT_INVALID_INPUT = 3;

    @FunctionalInterface
    public interface SessionFactory {
        ClusterSession open(String context, GuardSettings settings);
    }

    private final SessionFactory sessionFactory;
    private final Ticker ticker;

    @Option(names = {"--root"}, description = "State root for operation records, backups and audit log",
            defaultValue = StsGuardConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--context"}, description = "kubeconfig context (default: current context)")
    String context;

    public StsGuardCommand() {
        this(KubernetesBackend::connect, Ticker.SYSTEM);
    }

    public StsGuardCommand(SessionFactory sessionFactory, Ticker ticker) {
        this.sessionFactory = sessionFactory;
        this.ticker = ticker;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: safe-apply | diff-check | force-recreate | backup | restore | history");
    }

    StsGuardConfig config() {
        return StsGuardConfig.fromRoot(root);
    }

    <T> T withOrchestrator(Function<SafeApplyOrchestrator, T> body) {
        StsGuardConfig config = config();
        GuardSettings settings = GuardSettings.load(config.settingsFile());
        try (ClusterSession session = sessionFactory.open(context, settings)) {
            SafeApplyOrchestrator orchestrator = new SafeApplyOrchestrator(
                    config,
                    settings,
                    session.controlPlane(),
                    session.dataStore(),
                    session.volumeArchiver(),
                    ticker
            );
            return body.apply(orchestrator);
        }
    }

    /**
     * Runs {@code body}, turning input problems into exit code 3 and pre-destructive refusals into 2.
     */
    static int guarded(Callable<Integer> body) {
        try {
            return body.call();
        } catch (InvalidManifestException | IllegalArgumentException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (IdentityBusyException | BackupFailedException | ControlPlaneException e) {
            System.err.println(e.getMessage());
            return EXIT_REJECTED;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    static int exitCode(Outcome outcome) {
        return switch (outcome) {
            case SUCCEEDED -> EXIT_OK;
            case DEGRADED -> EXIT_DEGRADED;
            case FAILED, BUSY -> EXIT_REJECTED;
        };
    }

    static int report(OperationRecord record, boolean json) {
        if (json) {
            System.out.println(Jsons.toJson(record));
        } else {
            RecordPrinter.printRecord(System.out, record);
        }
        return exitCode(record.outcome());
    }

    static WorkloadSpec manifestFor(WorkloadIdentity identity, Path manifest) {
        WorkloadSpec desired = ManifestLoader.load(manifest, identity.namespace());
        if (!identity.equals(desired.identity())) {
            throw new InvalidManifestException("Manifest " + manifest + " describes " + desired.identity().key()
                    + ", not " + identity.key());
        }
        return desired;
    }

    static String defaultNamespace(String namespace) {
        return namespace == null || namespace.isBlank() ? WorkloadIdentity.DEFAULT_NAMESPACE : namespace;
    }

    @Command(name = "safe-apply", description = "Apply a manifest, recreating the workload when protected fields change")
    static final class SafeApplyCommand implements Callable<Integer> {
        @ParentCommand
        StsGuardCommand parent;

        @Parameters(index = "0", description = "StatefulSet manifest (YAML or JSON)")
        Path manifest;

        @Option(names = {"--namespace", "-n"}, description = "Namespace for a manifest that does not declare one")
        String namespace;

        @Option(names = {"--backup"}, arity = "1", defaultValue = "true",
                description = "Take a verified backup before any destructive step (default: ${DEFAULT-VALUE})")
        boolean backup;

        @Option(names = {"--json"}, description = "Print the operation record as JSON")
        boolean json;

        @Override
        public Integer call() {
            return guarded(() -> {
                WorkloadSpec desired = ManifestLoader.load(manifest, namespace);
                OperationRecord record = parent.withOrchestrator(o -> o.safeApply(desired, backup));
                return report(record, json);
            });
        }
    }

    @Command(name = "diff-check", description = "Report whether applying a manifest would require recreation")
    static final class DiffCheckCommand implements Callable<Integer> {
        @ParentCommand
        StsGuardCommand parent;

        @Parameters(index = "0", description = "namespace/name, or name with --namespace")
        String identity;

        @Parameters(index = "1", description = "StatefulSet manifest (YAML or JSON)")
        Path manifest;

        @Option(names = {"--namespace", "-n"}, description = "Namespace for a bare identity")
        String namespace;

        @Option(names = {"--json"}, description = "Print the diff as JSON")
        boolean json;

        @Override
        public Integer call() {
            return guarded(() -> {
                WorkloadIdentity target = WorkloadIdentity.parse(identity, defaultNamespace(namespace));
                WorkloadSpec desired = manifestFor(target, manifest);
                FieldDiff diff = parent.withOrchestrator(o -> o.diffCheck(target, desired));
                if (json) {
                    System.out.println(Jsons.toJson(diff));
                } else {
                    RecordPrinter.printDiff(System.out, target.key(), diff);
                }
                return diff.kind() == FieldDiff.Kind.UPDATE && !diff.isEmpty() ? EXIT_DEGRADED : EXIT_OK;
            });
        }
    }

    @Command(name = "force-recreate", description = "Run the backup / delete / recreate / restore cycle unconditionally")
    static final class ForceRecreateCommand implements Callable<Integer> {
        @ParentCommand
        StsGuardCommand parent;

        @Parameters(index = "0", description = "namespace/name, or name with --namespace")
        String identity;

        @Parameters(index = "1", description = "StatefulSet manifest (YAML or JSON)")
        Path manifest;

        @Option(names = {"--namespace", "-n"}, description = "Namespace for a bare identity")
        String namespace;

        @Option(names = {"--backup"}, arity = "1", defaultValue = "true",
                description = "Take a verified backup before deleting (default: ${DEFAULT-VALUE})")
        boolean backup;

        @Option(names = {"--json"}, description = "Print the operation record as JSON")
        boolean json;

        @Override
        public Integer call() {
            return guarded(() -> {
                WorkloadIdentity target = WorkloadIdentity.parse(identity, defaultNamespace(namespace));
                WorkloadSpec desired = manifestFor(target, manifest);
                OperationRecord record = parent.withOrchestrator(o -> o.forceRecreate(desired, backup));
                return report(record, json);
            });
        }
    }

    @Command(name = "backup", description = "Take a verified backup without touching the workload")
    static final class BackupCommand implements Callable<Integer> {
        @ParentCommand
        StsGuardCommand parent;

        @Parameters(index = "0", description = "namespace/name, or name with --namespace")
        String identity;

        @Option(names = {"--namespace", "-n"}, description = "Namespace for a bare identity")
        String namespace;

        @Override
        public Integer call() {
            return guarded(() -> {
                WorkloadIdentity target = WorkloadIdentity.parse(identity, defaultNamespace(namespace));
                BackupArtifact artifact = parent.withOrchestrator(o -> o.backupNow(target));
                System.out.println(Jsons.toJson(artifact));
                return EXIT_OK;
            });
        }
    }

    @Command(name = "restore", description = "Replay a stored backup artifact into the workload")
    static final class RestoreCommand implements Callable<Integer> {
        @ParentCommand
        StsGuardCommand parent;

        @Parameters(index = "0", description = "namespace/name, or name with --namespace")
        String identity;

        @Parameters(index = "1", description = "Artifact id, as printed by backup or history")
        String artifactId;

        @Option(names = {"--namespace", "-n"}, description = "Namespace for a bare identity")
        String namespace;

        @Override
        public Integer call() {
            return guarded(() -> {
                WorkloadIdentity target = WorkloadIdentity.parse(identity, defaultNamespace(namespace));
                RestoreResult result = parent.withOrchestrator(o -> o.restoreNow(target, artifactId));
                System.out.println(Jsons.toJson(result));
                return result.restored() ? EXIT_OK : EXIT_DEGRADED;
            });
        }
    }

    @Command(name = "history", description = "List persisted operation records, newest first")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        StsGuardCommand parent;

        @Parameters(index = "0", description = "namespace/name, or name with --namespace")
        String identity;

        @Option(names = {"--namespace", "-n"}, description = "Namespace for a bare identity")
        String namespace;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Maximum number of records")
        int limit;

        @Override
        public Integer call() {
            return guarded(() -> {
                WorkloadIdentity target = WorkloadIdentity.parse(identity, defaultNamespace(namespace));
                List<OperationRecord> records = parent.withOrchestrator(o -> o.history(target, limit));
                System.out.println(Jsons.toJson(records));
                return EXIT_OK;
            });
        }
    }
}
