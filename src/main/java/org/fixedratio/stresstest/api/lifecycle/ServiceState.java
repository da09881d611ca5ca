package org.fixedratio.stresstest.api.lifecycle;

/**
 * Process-wide state of the stress test system.
 * <p>
 * The transient states ({@link #STARTING}, {@link #PAUSING}, {@link #RESUMING},
 * {@link #STOPPING}) are held only while the lifecycle lock is taken.
 */
public enum ServiceState {
    STOPPED,
    STARTING,
    STARTED,
    PAUSING,
    PAUSED,
    RESUMING,
    STOPPING,
    ERROR
}
