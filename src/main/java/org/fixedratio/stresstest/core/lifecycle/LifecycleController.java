package org.fixedratio.stresstest.core.lifecycle;

import org.fixedratio.stresstest.api.lifecycle.IServiceLifecycle;
import org.fixedratio.stresstest.api.lifecycle.IStateChangeListener;
import org.fixedratio.stresstest.api.lifecycle.IStressTestEngine;
import org.fixedratio.stresstest.api.lifecycle.ServiceHealthStatus;
import org.fixedratio.stresstest.api.lifecycle.ServiceState;
import org.fixedratio.stresstest.api.lifecycle.StateChange;
import org.fixedratio.stresstest.core.workers.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide lifecycle state machine.
 * <p>
 * Every state-changing call takes a single lock before looking at the state, so transitions never
 * race. A fresh {@link IStressTestEngine} is built on every start and discarded on every stop.
 * Calls that are not valid in the current state are ignored with a warning.
 *
 * <pre>
 * STOPPED -> STARTING -> STARTED -> PAUSING -> PAUSED -> RESUMING -> STARTED
 *                   \                                                   |
 *                    -> ERROR          STARTED/PAUSED/ERROR -> STOPPING -> STOPPED
 * </pre>
 */
public class LifecycleController implements IServiceLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleController.class);

    private final Supplier<IStressTestEngine> engineFactory;
    private final WorkerPool workerPool;
    private final SystemState systemState;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<IStateChangeListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ServiceState state = ServiceState.STOPPED;
    private volatile IStressTestEngine engine;

    public LifecycleController(Supplier<IStressTestEngine> engineFactory, WorkerPool workerPool, SystemState systemState) {
        this.engineFactory = engineFactory;
        this.workerPool = workerPool;
        this.systemState = systemState;
    }

    /**
     * Builds and starts a new engine. Only valid from {@link ServiceState#STOPPED}.
     *
     * @throws LifecycleException if the engine fails to start; the state is then {@link ServiceState#ERROR}.
     */
    @Override
    public void start() {
        lock.lock();
        try {
            if (state != ServiceState.STOPPED) {
                LOGGER.warn("Cannot start from state {}, ignoring", state);
                return;
            }
            transition(ServiceState.STARTING, "start requested");
            IStressTestEngine created = null;
            try {
                created = engineFactory.get();
                engine = created;
                created.start();
                transition(ServiceState.STARTED, "engine started");
            } catch (Exception e) {
                transition(ServiceState.ERROR, "start failed: " + e.getMessage());
                engine = null;
                disposeQuietly(created);
                throw new LifecycleException("Failed to start the stress test engine", e);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops all workers, then the engine. Calling this when already stopped does nothing.
     */
    @Override
    public void stop() {
        lock.lock();
        try {
            if (state == ServiceState.STOPPED) {
                LOGGER.debug("Already stopped");
                return;
            }
            transition(ServiceState.STOPPING, "stop requested");
            workerPool.forceStopAll();
            systemState.setPaused(false);
            IStressTestEngine current = engine;
            engine = null;
            disposeQuietly(current);
            transition(ServiceState.STOPPED, "engine stopped");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void pause() {
        lock.lock();
        try {
            if (state != ServiceState.STARTED) {
                LOGGER.warn("Cannot pause from state {}, ignoring", state);
                return;
            }
            transition(ServiceState.PAUSING, "pause requested");
            systemState.setPaused(true);
            engine.pause();
            transition(ServiceState.PAUSED, "workers paused");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void resume() {
        lock.lock();
        try {
            if (state != ServiceState.PAUSED) {
                LOGGER.warn("Cannot resume from state {}, ignoring", state);
                return;
            }
            transition(ServiceState.RESUMING, "resume requested");
            systemState.setPaused(false);
            engine.resume();
            transition(ServiceState.STARTED, "workers resumed");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ServiceState getState() {
        return state;
    }

    /**
     * Returns a snapshot without taking the lifecycle lock.
     */
    @Override
    public ServiceHealthStatus getHealth() {
        ServiceState current = state;
        IStressTestEngine currentEngine = engine;
        boolean paused = systemState.isPaused();
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("system_paused", paused ? 1 : 0);
        metrics.put("engine_exists", currentEngine != null ? 1 : 0);

        if (currentEngine == null) {
            boolean healthy = current == ServiceState.STOPPED;
            return new ServiceHealthStatus(healthy, current == ServiceState.ERROR ? "Error" : "Stopped",
                current, metrics, Instant.now());
        }
        ServiceHealthStatus engineHealth = currentEngine.getHealth();
        metrics.putAll(engineHealth.metrics());
        boolean healthy = engineHealth.healthy() && !paused;
        String status = paused ? "Paused" : engineHealth.status();
        return new ServiceHealthStatus(healthy, status, current, metrics, Instant.now());
    }

    @Override
    public void addStateChangeListener(IStateChangeListener listener) {
        listeners.add(listener);
    }

    private void transition(ServiceState next, String reason) {
        ServiceState previous = state;
        state = next;
        LOGGER.info("State {} -> {} ({})", previous, next, reason);
        StateChange change = new StateChange(previous, next, Instant.now(), reason);
        for (IStateChangeListener listener : listeners) {
            try {
                listener.onStateChanged(change);
            } catch (RuntimeException e) {
                LOGGER.warn("State change listener failed: {}", e.getMessage());
            }
        }
    }

    private void disposeQuietly(IStressTestEngine target) {
        if (target == null) {
            return;
        }
        try {
            target.stop();
        } catch (RuntimeException e) {
            LOGGER.error("Error while stopping engine: {}", e.getMessage());
            LOGGER.debug("Exception details:", e);
        }
        try {
            target.close();
        } catch (RuntimeException e) {
            LOGGER.error("Error while closing engine: {}", e.getMessage());
            LOGGER.debug("Exception details:", e);
        }
    }
}
