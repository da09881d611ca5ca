package org.fixedratio.stresstest.api.lifecycle;

/**
 * Whole-system lifecycle as seen by hosting shells and the command line.
 */
public interface IServiceLifecycle {

    void start();

    void stop();

    void pause();

    void resume();

    ServiceState getState();

    ServiceHealthStatus getHealth();

    void addStateChangeListener(IStateChangeListener listener);
}
