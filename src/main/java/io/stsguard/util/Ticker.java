package io.stsguard.util;

public interface Ticker {
    Ticker SYSTEM = new Ticker() {
        @Override
        public long nowMs() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleepMs(long millis) throws InterruptedException {
            if (millis > 0L) {
                Thread.sleep(millis);
            }
        }
    };

    long nowMs();

    void sleepMs(long millis) throws InterruptedException;
}
