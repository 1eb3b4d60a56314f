package io.stsguard.cluster;

public class DataStoreUnreachableException extends RuntimeException {
    public DataStoreUnreachableException(String message) {
        super(message);
    }

    public DataStoreUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
