package io.calcrelay.engine;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop flag that also cuts waits short.
 */
public final class StopSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void request() {
        latch.countDown();
    }

    public boolean isRequested() {
        return latch.getCount() == 0L;
    }

    /**
     * Sleeps up to {@code millis}.
     *
     * @return true if the stop was requested before or during the wait
     */
    public boolean await(long millis) {
        try {
            return latch.await(Math.max(0L, millis), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
