package io.stsguard.cluster;

public record DumpResult(
        byte[] data,
        int exitStatus,
        String stderr
) {
    public DumpResult {
        data = data == null ? new byte[0] : data;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean succeeded() {
        return exitStatus == 0;
    }
}
