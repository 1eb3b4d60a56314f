package io.stsguard.runtime;

import io.stsguard.model.ApplyPath;
import io.stsguard.model.BackupArtifact;
import io.stsguard.model.ErrorKind;
import io.stsguard.model.FieldDiff;
import io.stsguard.model.OperationIssue;
import io.stsguard.model.OperationMode;
import io.stsguard.model.OperationRecord;
import io.stsguard.model.Outcome;
import io.stsguard.model.Phase;
import io.stsguard.model.PhaseMark;
import io.stsguard.model.WorkloadIdentity;
import io.stsguard.observability.AuditLogger;
import io.stsguard.storage.OperationStore;
import io.stsguard.util.Ticker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class OperationRecorder {
    private final OperationStore store;
    private final AuditLogger auditLogger;
    private final Ticker ticker;
    private final String operationId;
    private final WorkloadIdentity identity;
    private final OperationMode mode;
    private final boolean backupEnabled;
    private final Instant startedAt;
    private final List<PhaseMark> phases = new ArrayList<>();
    private final List<OperationIssue> issues = new ArrayList<>();

    private Phase current = Phase.IDLE;
    private Phase reached = Phase.IDLE;
    private boolean destructiveStarted;
    private ApplyPath path = ApplyPath.NONE;
    private FieldDiff diff;
    private BackupArtifact artifact;
    private String resumedFrom;
    private OperationRecord finalRecord;

    OperationRecorder(
            OperationStore store,
            AuditLogger auditLogger,
            Ticker ticker,
            String operationId,
            WorkloadIdentity identity,
            OperationMode mode,
            boolean backupEnabled
    ) {
        this.store = store;
        this.auditLogger = auditLogger;
        this.ticker = ticker;
        this.operationId = operationId;
        this.identity = identity;
        this.mode = mode;
        this.backupEnabled = backupEnabled;
        this.startedAt = now();
        phases.add(new PhaseMark(Phase.IDLE, startedAt, mode.name()));
    }

    void begin() {
        store.save(snapshot());
        audit("operation.start", "started", Map.of(
                "mode", mode.name(),
                "backup_enabled", backupEnabled
        ));
    }

    void enter(Phase next, String detail) {
        if (finalRecord != null) {
            throw new IllegalStateException("Operation " + operationId + " is already final");
        }
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal phase transition " + current + " -> " + next
                    + " in operation " + operationId);
        }
        current = next;
        if (!next.terminal()) {
            reached = next;
        }
        destructiveStarted |= next.destructive();
        phases.add(new PhaseMark(next, now(), detail));
        store.save(snapshot());
        Map<String, Object> details = new LinkedHashMap<>();
        if (detail != null && !detail.isBlank()) {
            details.put("detail", detail);
        }
        audit("phase.enter", next.name(), details);
    }

    void issue(ErrorKind kind, String message) {
        issues.add(new OperationIssue(kind, current, message, now()));
        audit("operation.issue", kind.name(), Map.of("message", message == null ? "" : message));
    }

    /**
     * Moves to the terminal phase and writes the final record. {@link Phase#FAILED} is only
     * honoured while no destructive phase has been entered; otherwise the run ends degraded.
     */
    OperationRecord finish(Phase terminal) {
        if (!terminal.terminal()) {
            throw new IllegalArgumentException("Not a terminal phase: " + terminal);
        }
        Phase target = terminal;
        if (target == Phase.FAILED && !current.canTransitionTo(Phase.FAILED)) {
            target = Phase.DEGRADED;
        }
        if (target == Phase.SUCCEEDED && hasDegradingIssue()) {
            target = Phase.DEGRADED;
        }
        if (target == Phase.DEGRADED && !current.canTransitionTo(Phase.DEGRADED)) {
            enter(Phase.VERIFYING, "closing out after " + current);
        }
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal phase transition " + current + " -> " + target
                    + " in operation " + operationId);
        }
        current = target;
        phases.add(new PhaseMark(target, now(), null));
        finalRecord = build(outcomeFor(target), now());
        store.save(finalRecord);
        audit("operation.finish", finalRecord.outcome().name(), Map.of(
                "path", path.name(),
                "phase_reached", reached.name(),
                "issues", issues.size()
        ));
        return finalRecord;
    }

    boolean finished() {
        return finalRecord != null;
    }

    boolean destructiveStarted() {
        return destructiveStarted;
    }

    Phase phase() {
        return current;
    }

    String operationId() {
        return operationId;
    }

    void path(ApplyPath value) {
        this.path = value;
    }

    void diff(FieldDiff value) {
        this.diff = value;
    }

    void artifact(BackupArtifact value) {
        this.artifact = value;
    }

    void resumedFrom(String priorOperationId) {
        this.resumedFrom = priorOperationId;
    }

    OperationRecord snapshot() {
        return build(null, null);
    }

    private boolean hasDegradingIssue() {
        return issues.stream().anyMatch(issue -> issue.kind().degrading());
    }

    private OperationRecord build(Outcome outcome, Instant finishedAt) {
        return new OperationRecord(
                operationId,
                identity,
                mode,
                path,
                backupEnabled,
                phases,
                reached,
                outcome,
                issues,
                diff,
                artifact,
                resumedFrom,
                startedAt,
                finishedAt
        );
    }

    private static Outcome outcomeFor(Phase terminal) {
        return switch (terminal) {
            case SUCCEEDED -> Outcome.SUCCEEDED;
            case DEGRADED -> Outcome.DEGRADED;
            default -> Outcome.FAILED;
        };
    }

    private void audit(String action, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.ofOperation(
                action,
                identity.key(),
                result,
                operationId,
                current.name(),
                details
        ));
    }

    private Instant now() {
        return Instant.ofEpochMilli(ticker.nowMs());
    }
}
