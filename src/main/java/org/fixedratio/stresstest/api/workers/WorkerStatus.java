package org.fixedratio.stresstest.api.workers;

/**
 * Lifecycle stage of a single worker. The status reflects the lifecycle only,
 * never the outcome of the last operation.
 */
public enum WorkerStatus {
    /** Created and persisted, never started. */
    CREATED,
    /** Loop thread is active. */
    RUNNING,
    /** Loop ended by an explicit stop. */
    STOPPED,
    /** Loop ended by a system-wide pause; restarted on resume. */
    PAUSED,
    /** Stop signalled, loop not yet observed to end. */
    STOPPING,
    /** Could not be started (wallet restore or funding failed). */
    FAILED,
    /** Loop did not terminate within the stop timeout. */
    ERROR;

    /**
     * Returns whether this status counts against the health of the engine.
     *
     * @return {@code true} for {@link #FAILED} and {@link #ERROR}.
     */
    public boolean isFaulted() {
        return this == FAILED || this == ERROR;
    }
}
