package io.stsguard.util;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Polls a probe until a condition holds or a deadline passes. The interval grows by
 * {@code multiplier} after each unsuccessful probe and is capped at {@code maxIntervalMs};
 * a multiplier of 1 gives fixed-interval polling.
 */
public final class BoundedPoller {
    private final Ticker ticker;
    private final long initialIntervalMs;
    private final double multiplier;
    private final long maxIntervalMs;

    public BoundedPoller(Ticker ticker, long initialIntervalMs, double multiplier, long maxIntervalMs) {
        this.ticker = ticker == null ? Ticker.SYSTEM : ticker;
        this.initialIntervalMs = Math.max(1L, initialIntervalMs);
        this.multiplier = multiplier < 1.0d ? 1.0d : multiplier;
        this.maxIntervalMs = Math.max(this.initialIntervalMs, maxIntervalMs);
    }

    public static BoundedPoller fixed(Ticker ticker, long intervalMs) {
        return new BoundedPoller(ticker, intervalMs, 1.0d, intervalMs);
    }

    public <T> PollOutcome<T> poll(long timeoutMs, Supplier<T> probe, Predicate<T> done) {
        return poll(timeoutMs, 1, probe, done);
    }

    public <T> PollOutcome<T> poll(long timeoutMs, int consecutive, Supplier<T> probe, Predicate<T> done) {
        int required = Math.max(1, consecutive);
        long startMs = ticker.nowMs();
        long deadlineMs = startMs + Math.max(0L, timeoutMs);
        long intervalMs = initialIntervalMs;
        int attempts = 0;
        int streak = 0;
        T last = null;
        while (true) {
            last = probe.get();
            attempts++;
            if (done.test(last)) {
                streak++;
                if (streak >= required) {
                    return new PollOutcome<>(true, last, attempts, ticker.nowMs() - startMs);
                }
            } else {
                streak = 0;
            }
            long nowMs = ticker.nowMs();
            if (nowMs >= deadlineMs) {
                return new PollOutcome<>(false, last, attempts, nowMs - startMs);
            }
            long waitMs = streak > 0 ? initialIntervalMs : intervalMs;
            try {
                ticker.sleepMs(Math.min(waitMs, deadlineMs - nowMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new PollOutcome<>(false, last, attempts, ticker.nowMs() - startMs);
            }
            if (streak == 0) {
                intervalMs = Math.min(maxIntervalMs, (long) Math.ceil(intervalMs * multiplier));
            }
        }
    }

    public record PollOutcome<T>(
            boolean satisfied,
            T last,
            int attempts,
            long elapsedMs
    ) {
    }
}
