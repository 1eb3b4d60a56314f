package io.stsguard.restore;

import io.stsguard.model.ErrorKind;

public record RestoreResult(
        boolean restored,
        String artifactId,
        ErrorKind errorKind,
        String detail
) {
    public static RestoreResult ok(String artifactId) {
        return new RestoreResult(true, artifactId, null, "restored");
    }

    public static RestoreResult partial(String artifactId, String detail) {
        return new RestoreResult(false, artifactId, ErrorKind.RESTORE_PARTIAL, detail);
    }
}
