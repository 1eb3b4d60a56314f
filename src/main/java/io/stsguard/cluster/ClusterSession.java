package io.stsguard.cluster;

public interface ClusterSession extends AutoCloseable {
    ControlPlane controlPlane();

    DataStore dataStore();

    VolumeArchiver volumeArchiver();

    @Override
    void close();
}
