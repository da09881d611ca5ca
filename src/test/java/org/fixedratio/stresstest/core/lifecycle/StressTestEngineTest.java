package org.fixedratio.stresstest.core.lifecycle;

import org.fixedratio.stresstest.api.lifecycle.ServiceHealthStatus;
import org.fixedratio.stresstest.core.workers.WorkerPool;
import org.fixedratio.stresstest.junit.extensions.logging.ExpectLog;
import org.fixedratio.stresstest.junit.extensions.logging.LogLevel;
import org.fixedratio.stresstest.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class StressTestEngineTest {

    @Mock
    private WorkerPool workerPool;

    private final List<String> calls = new ArrayList<>();

    private IStartupRoutine routine(String name, boolean fail) {
        return new IStartupRoutine() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public void start() throws Exception {
                calls.add("start " + name);
                if (fail) {
                    throw new Exception(name + " failed");
                }
            }

            @Override
            public void stop() {
                calls.add("stop " + name);
            }
        };
    }

    @Test
    void routinesStartInOrderAndStopInReverse() throws Exception {
        StressTestEngine engine = new StressTestEngine(List.of(routine("a", false), routine("b", false)), workerPool);

        engine.start();
        assertTrue(engine.isRunning());
        engine.stop();

        assertFalse(engine.isRunning());
        assertThat(calls).containsExactly("start a", "start b", "stop b", "stop a");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Startup routine 'c' failed: c failed")
    void failingRoutineRollsBackEarlierOnes() {
        StressTestEngine engine = new StressTestEngine(
            List.of(routine("a", false), routine("b", false), routine("c", true), routine("d", false)), workerPool);

        assertThatThrownBy(engine::start).hasMessage("c failed");

        assertFalse(engine.isRunning());
        assertThat(calls).containsExactly("start a", "start b", "start c", "stop b", "stop a");
    }

    @Test
    void closeStopsOnlyOnce() throws Exception {
        StressTestEngine engine = new StressTestEngine(List.of(routine("a", false)), workerPool);
        engine.start();

        engine.close();
        engine.close();

        assertThat(calls).containsExactly("start a", "stop a");
    }

    @Test
    void pauseAndResumeDelegateToWorkerPool() {
        StressTestEngine engine = new StressTestEngine(List.of(), workerPool);

        engine.pause();
        engine.resume();

        verify(workerPool).pauseAll();
        verify(workerPool).resumePaused();
    }

    @Test
    void healthIsDegradedWhenMostWorkersFailed() throws Exception {
        when(workerPool.getMetrics()).thenReturn(metrics(3, 2));
        StressTestEngine engine = new StressTestEngine(List.of(), workerPool);
        engine.start();

        ServiceHealthStatus health = engine.getHealth();

        assertFalse(health.healthy());
        assertEquals("Degraded", health.status());
    }

    @Test
    void healthIsHealthyWithFewFailures() throws Exception {
        when(workerPool.getMetrics()).thenReturn(metrics(4, 2));
        StressTestEngine engine = new StressTestEngine(List.of(), workerPool);
        engine.start();

        ServiceHealthStatus health = engine.getHealth();

        assertTrue(health.healthy());
        assertEquals("Healthy", health.status());
        assertEquals(4, health.metrics().get("workers_total").intValue());
    }

    private static Map<String, Number> metrics(long total, long failed) {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("workers_total", total);
        metrics.put("workers_running", total - failed);
        metrics.put("workers_paused", 0L);
        metrics.put("workers_failed", failed);
        return metrics;
    }
}
