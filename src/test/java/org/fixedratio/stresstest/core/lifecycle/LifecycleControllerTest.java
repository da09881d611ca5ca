package org.fixedratio.stresstest.core.lifecycle;

import org.fixedratio.stresstest.api.lifecycle.IStressTestEngine;
import org.fixedratio.stresstest.api.lifecycle.ServiceHealthStatus;
import org.fixedratio.stresstest.api.lifecycle.ServiceState;
import org.fixedratio.stresstest.api.lifecycle.StateChange;
import org.fixedratio.stresstest.core.workers.WorkerPool;
import org.fixedratio.stresstest.junit.extensions.logging.ExpectLog;
import org.fixedratio.stresstest.junit.extensions.logging.LogLevel;
import org.fixedratio.stresstest.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class LifecycleControllerTest {

    @Mock
    private IStressTestEngine engine;

    @Mock
    private WorkerPool workerPool;

    private SystemState systemState;
    private AtomicInteger enginesCreated;
    private LifecycleController controller;

    @BeforeEach
    void setUp() {
        systemState = new SystemState();
        enginesCreated = new AtomicInteger();
        controller = new LifecycleController(() -> {
            enginesCreated.incrementAndGet();
            return engine;
        }, workerPool, systemState);
    }

    @Test
    void startBuildsAndStartsEngine() throws Exception {
        controller.start();

        assertEquals(ServiceState.STARTED, controller.getState());
        assertEquals(1, enginesCreated.get());
        verify(engine).start();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Cannot start from state STARTED, ignoring")
    void secondStartIsIgnored() throws Exception {
        controller.start();
        controller.start();

        assertEquals(1, enginesCreated.get());
        verify(engine, times(1)).start();
    }

    @Test
    @DisplayName("Stop halts workers before the engine and can be repeated")
    void stopIsIdempotent() throws Exception {
        controller.start();

        controller.stop();
        controller.stop();

        assertEquals(ServiceState.STOPPED, controller.getState());
        verify(workerPool, times(1)).forceStopAll();
        verify(engine).stop();
        verify(engine).close();
    }

    @Test
    void stopWithoutStartDoesNothing() {
        controller.stop();

        assertEquals(ServiceState.STOPPED, controller.getState());
        verify(workerPool, never()).forceStopAll();
    }

    @Test
    void restartBuildsFreshEngine() {
        controller.start();
        controller.stop();
        controller.start();

        assertEquals(2, enginesCreated.get());
        assertEquals(ServiceState.STARTED, controller.getState());
    }

    @Test
    void pauseAndResumeToggleSystemFlag() {
        controller.start();

        controller.pause();
        assertEquals(ServiceState.PAUSED, controller.getState());
        assertTrue(systemState.isPaused());
        verify(engine).pause();

        controller.resume();
        assertEquals(ServiceState.STARTED, controller.getState());
        assertFalse(systemState.isPaused());
        verify(engine).resume();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Cannot resume from state STARTED, ignoring")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Cannot pause from state STOPPED, ignoring")
    void invalidTransitionsAreIgnored() {
        controller.pause();
        controller.start();
        controller.resume();

        assertEquals(ServiceState.STARTED, controller.getState());
    }

    @Test
    void stopWhilePausedClearsPauseFlag() {
        controller.start();
        controller.pause();

        controller.stop();

        assertEquals(ServiceState.STOPPED, controller.getState());
        assertFalse(systemState.isPaused());
    }

    @Test
    void failedStartEndsInError() throws Exception {
        doThrow(new IllegalStateException("contract too new")).when(engine).start();

        assertThatThrownBy(() -> controller.start())
            .isInstanceOf(LifecycleException.class)
            .hasRootCauseMessage("contract too new");
        assertEquals(ServiceState.ERROR, controller.getState());
        verify(engine).close();

        ServiceHealthStatus health = controller.getHealth();
        assertFalse(health.healthy());
        assertEquals("Error", health.status());

        controller.stop();
        assertEquals(ServiceState.STOPPED, controller.getState());
    }

    @Test
    void listenersSeeEveryTransition() {
        List<StateChange> changes = new CopyOnWriteArrayList<>();
        controller.addStateChangeListener(changes::add);

        controller.start();
        controller.stop();

        assertThat(changes).extracting(StateChange::current).containsExactly(
            ServiceState.STARTING, ServiceState.STARTED, ServiceState.STOPPING, ServiceState.STOPPED);
    }

    @Test
    void healthReflectsEngineAndPause() {
        assertTrue(controller.getHealth().healthy());
        assertEquals("Stopped", controller.getHealth().status());

        when(engine.getHealth()).thenReturn(new ServiceHealthStatus(true, "Healthy", ServiceState.STARTED,
            Map.of("workers_total", 2), Instant.now()));
        controller.start();

        ServiceHealthStatus running = controller.getHealth();
        assertTrue(running.healthy());
        assertEquals("Healthy", running.status());
        assertEquals(2, running.metrics().get("workers_total").intValue());
        assertEquals(1, running.metrics().get("engine_exists").intValue());

        controller.pause();
        ServiceHealthStatus paused = controller.getHealth();
        assertFalse(paused.healthy());
        assertEquals("Paused", paused.status());
    }
}
