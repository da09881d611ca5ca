package org.fixedratio.stresstest.core.workers;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one worker loop.
 * <p>
 * Every wait inside the loop and its recovery policies goes through
 * {@link #waitOrCancelled(Duration)}, which returns as soon as {@link #cancel()} is called.
 */
public final class CancellationHandle {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch signal = new CountDownLatch(1);

    /**
     * Signals cancellation. Idempotent.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.countDown();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits for the given duration unless cancelled first. An interrupt of the waiting
     * thread is treated as cancellation; the interrupt flag is restored.
     *
     * @param duration How long to wait.
     * @return {@code true} if the handle was cancelled before or during the wait.
     */
    public boolean waitOrCancelled(Duration duration) {
        if (isCancelled()) {
            return true;
        }
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        try {
            return signal.await(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }
}
