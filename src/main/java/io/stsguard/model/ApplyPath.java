package io.stsguard.model;

public enum ApplyPath {
    NONE,
    CREATE,
    FAST,
    RECREATE
}
