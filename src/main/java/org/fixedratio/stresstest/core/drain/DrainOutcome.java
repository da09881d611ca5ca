package org.fixedratio.stresstest.core.drain;

/**
 * Outcome of draining a worker.
 */
public enum DrainOutcome {
    /** The worker held nothing; no burn, operation or sweep took place. */
    NOTHING_TO_DRAIN,
    /** The balance was burned and the terminal operation succeeded. */
    COMPLETED,
    /** The balance was burned but the terminal operation failed. The burn stands. */
    OPERATION_FAILED
}
