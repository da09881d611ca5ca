package org.fixedratio.stresstest.api.lifecycle;

/**
 * Receives lifecycle transitions. Called while the lifecycle lock is held, so
 * implementations must return quickly and must not call back into the controller.
 */
@FunctionalInterface
public interface IStateChangeListener {

    void onStateChanged(StateChange change);
}
