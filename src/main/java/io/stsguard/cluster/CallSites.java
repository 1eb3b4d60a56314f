package io.stsguard.cluster;

import java.util.function.Supplier;

public final class CallSites {
    private CallSites() {
    }

    /**
     * Runs {@code call}; on a {@link TransportException} retries once immediately and lets a
     * second failure propagate. Rejections are never retried here.
     */
    public static <T> T retryTransportOnce(Supplier<T> call) {
        try {
            return call.get();
        } catch (TransportException first) {
            try {
                return call.get();
            } catch (TransportException second) {
                second.addSuppressed(first);
                throw second;
            }
        }
    }

    public static void retryTransportOnce(Runnable call) {
        retryTransportOnce(() -> {
            call.run();
            return null;
        });
    }
}
