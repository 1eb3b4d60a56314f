package io.stsguard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Audit trail of one safe-apply invocation. A record without {@code outcome} is a checkpoint of
 * a run still in progress (or one whose process died).
 */
public record OperationRecord(
        String operationId,
        WorkloadIdentity identity,
        OperationMode mode,
        ApplyPath path,
        boolean backupEnabled,
        List<PhaseMark> phases,
        Phase phaseReached,
        Outcome outcome,
        List<OperationIssue> issues,
        FieldDiff diff,
        BackupArtifact artifact,
        String resumedFrom,
        Instant startedAt,
        Instant finishedAt
) {
    public OperationRecord {
        phases = phases == null ? List.of() : List.copyOf(phases);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    @JsonIgnore
    public boolean finished() {
        return outcome != null;
    }

    public boolean hasIssue(ErrorKind kind) {
        return issues.stream().anyMatch(issue -> issue.kind() == kind);
    }
}
