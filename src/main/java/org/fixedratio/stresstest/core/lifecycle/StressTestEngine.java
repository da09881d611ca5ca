package org.fixedratio.stresstest.core.lifecycle;

import org.fixedratio.stresstest.api.lifecycle.IStressTestEngine;
import org.fixedratio.stresstest.api.lifecycle.ServiceHealthStatus;
import org.fixedratio.stresstest.api.lifecycle.ServiceState;
import org.fixedratio.stresstest.core.workers.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the startup routines and reports the aggregated health of the workers.
 * <p>
 * The engine does not own the worker pool; the pool outlives engines so that workers and their
 * statistics survive a stop and start of the system.
 */
public class StressTestEngine implements IStressTestEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(StressTestEngine.class);

    private final List<IStartupRoutine> routines;
    private final WorkerPool workerPool;
    private final Deque<IStartupRoutine> started = new ArrayDeque<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public StressTestEngine(List<IStartupRoutine> routines, WorkerPool workerPool) {
        this.routines = List.copyOf(routines);
        this.workerPool = workerPool;
    }

    @Override
    public synchronized void start() throws Exception {
        if (running.get()) {
            throw new IllegalStateException("Engine is already running");
        }
        for (IStartupRoutine routine : routines) {
            LOGGER.debug("Starting routine '{}'", routine.getName());
            try {
                routine.start();
            } catch (Exception e) {
                LOGGER.error("Startup routine '{}' failed: {}", routine.getName(), e.getMessage());
                stopStartedRoutines();
                throw e;
            }
            started.push(routine);
        }
        running.set(true);
        LOGGER.info("Engine started with {} routine(s)", routines.size());
    }

    @Override
    public synchronized void stop() {
        if (!running.getAndSet(false) && started.isEmpty()) {
            return;
        }
        stopStartedRoutines();
        LOGGER.info("Engine stopped");
    }

    private void stopStartedRoutines() {
        while (!started.isEmpty()) {
            IStartupRoutine routine = started.pop();
            try {
                routine.stop();
                LOGGER.debug("Stopped routine '{}'", routine.getName());
            } catch (RuntimeException e) {
                LOGGER.error("Error while stopping routine '{}': {}", routine.getName(), e.getMessage());
                LOGGER.debug("Exception details:", e);
            }
        }
    }

    @Override
    public void pause() {
        workerPool.pauseAll();
    }

    @Override
    public void resume() {
        workerPool.resumePaused();
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Reports {@code Degraded} when more than half of all workers are failed or in error.
     */
    @Override
    public ServiceHealthStatus getHealth() {
        Map<String, Number> metrics = new LinkedHashMap<>(workerPool.getMetrics());
        long total = metrics.get("workers_total").longValue();
        long failed = metrics.get("workers_failed").longValue();
        boolean degraded = total > 0 && failed * 2 > total;
        boolean isRunning = running.get();

        String status = !isRunning ? "Stopped" : degraded ? "Degraded" : "Healthy";
        return new ServiceHealthStatus(isRunning && !degraded, status,
            isRunning ? ServiceState.STARTED : ServiceState.STOPPED, metrics, Instant.now());
    }

    @Override
    public void close() {
        stop();
    }
}
