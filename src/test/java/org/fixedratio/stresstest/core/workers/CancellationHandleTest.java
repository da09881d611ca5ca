package org.fixedratio.stresstest.core.workers;

import org.fixedratio.stresstest.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CancellationHandleTest {

    @Test
    void waitElapsesWhenNotCancelled() {
        CancellationHandle handle = new CancellationHandle();

        assertFalse(handle.waitOrCancelled(Duration.ofMillis(10)));
        assertFalse(handle.isCancelled());
    }

    @Test
    void cancelledHandleReturnsImmediately() {
        CancellationHandle handle = new CancellationHandle();
        handle.cancel();
        handle.cancel();

        long start = System.nanoTime();
        assertTrue(handle.waitOrCancelled(Duration.ofMinutes(5)));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void cancelWakesUpWaitingThread() throws Exception {
        CancellationHandle handle = new CancellationHandle();
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> handle.waitOrCancelled(Duration.ofMinutes(5)));

        Thread.sleep(50);
        handle.cancel();

        assertTrue(waiter.get(5, TimeUnit.SECONDS));
    }

    @Test
    void interruptCountsAsCancellation() {
        CancellationHandle handle = new CancellationHandle();
        Thread.currentThread().interrupt();
        try {
            assertTrue(handle.waitOrCancelled(Duration.ofSeconds(30)));
            assertTrue(handle.isCancelled());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void zeroWaitDoesNotBlock() {
        assertFalse(new CancellationHandle().waitOrCancelled(Duration.ZERO));
    }
}
