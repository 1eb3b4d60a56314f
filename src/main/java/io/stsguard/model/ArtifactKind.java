package io.stsguard.model;

public enum ArtifactKind {
    LOGICAL_DUMP("sql"),
    VOLUME_ARCHIVE("tar.gz");

    private final String extension;

    ArtifactKind(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
