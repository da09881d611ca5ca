package org.fixedratio.stresstest.core.lifecycle;

/**
 * A step the engine runs on start, in order, and undoes on stop, in reverse order.
 */
public interface IStartupRoutine {

    String getName();

    /**
     * Runs the routine.
     *
     * @throws Exception if the engine must not start.
     */
    void start() throws Exception;

    /**
     * Undoes the routine. The default does nothing.
     */
    default void stop() {
    }
}
