package io.stsguard.cli;

import io.stsguard.model.BackupArtifact;
import io.stsguard.model.FieldChange;
import io.stsguard.model.FieldDiff;
import io.stsguard.model.OperationIssue;
import io.stsguard.model.OperationRecord;
import io.stsguard.model.PhaseMark;

import java.io.PrintStream;
import java.util.Locale;

final class RecordPrinter {
    private RecordPrinter() {
    }

    static void printRecord(PrintStream out, OperationRecord record) {
        out.println(record.mode().name().toLowerCase(Locale.ROOT).replace('_', '-') + " "
                + record.identity().key() + "  operation=" + record.operationId());
        for (PhaseMark mark : record.phases()) {
            out.printf("  %-14s %s%s%n", mark.phase(), mark.at(),
                    mark.detail() == null || mark.detail().isBlank() ? "" : "  " + mark.detail());
        }
        if (!record.issues().isEmpty()) {
            out.println("issues:");
            for (OperationIssue issue : record.issues()) {
                out.println("  [" + issue.kind() + "] during " + issue.phase() + ": " + issue.message());
            }
        }
        BackupArtifact artifact = record.artifact();
        if (artifact != null) {
            out.println("artifact: " + artifact.artifactId() + " " + artifact.kind() + " "
                    + artifact.sizeBytes() + " bytes sha256=" + artifact.sha256());
        }
        out.println("status: " + record.outcome() + " (path " + record.path()
                + ", phase reached " + record.phaseReached() + ")");
    }

    static void printDiff(PrintStream out, String identity, FieldDiff diff) {
        if (diff.kind() == FieldDiff.Kind.CREATE) {
            out.println(identity + ": not present, would be created");
            return;
        }
        if (diff.isEmpty()) {
            out.println(identity + ": no protected field changes, in-place apply");
            return;
        }
        out.println(identity + ": recreate required, " + diff.changes().size() + " protected change(s)");
        for (FieldChange change : diff.changes()) {
            out.println("  " + change.fieldPath() + ": " + change.liveValue() + " -> " + change.desiredValue());
        }
    }
}
