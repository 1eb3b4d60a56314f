package io.stsguard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public record FieldDiff(
        Kind kind,
        List<FieldChange> changes
) {
    public enum Kind {
        CREATE,
        UPDATE
    }

    public FieldDiff {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static FieldDiff create() {
        return new FieldDiff(Kind.CREATE, List.of());
    }

    public static FieldDiff update(List<FieldChange> changes) {
        return new FieldDiff(Kind.UPDATE, changes);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public FieldDiff plus(FieldChange change) {
        List<FieldChange> merged = new ArrayList<>(changes);
        merged.add(change);
        return new FieldDiff(kind, merged);
    }
}
