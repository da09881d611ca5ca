package org.fixedratio.stresstest.api.lifecycle;

/**
 * The unit created and destroyed by the lifecycle controller on every start and stop.
 */
public interface IStressTestEngine extends AutoCloseable {

    /**
     * Runs all startup routines in order.
     *
     * @throws Exception if any routine fails; routines already started are stopped again.
     */
    void start() throws Exception;

    void stop();

    void pause();

    void resume();

    boolean isRunning();

    ServiceHealthStatus getHealth();

    /**
     * Releases the engine. Never throws.
     */
    @Override
    void close();
}
