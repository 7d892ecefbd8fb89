package com.jiracdc.core.engine;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag shared by all tasks of one operation.
 * Work checks it at safe points; blocking waits can be woken early by {@link #cancel()}.
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException("Operation was cancelled");
        }
    }

    /**
     * Sleeps for up to {@code duration}, returning early if cancelled.
     *
     * @return true if the signal fired during (or before) the wait
     */
    public boolean await(Duration duration) {
        try {
            return latch.await(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while waiting", e);
        }
    }
}
