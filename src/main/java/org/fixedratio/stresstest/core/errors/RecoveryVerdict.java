package org.fixedratio.stresstest.core.errors;

/**
 * What a worker loop does after a failed operation.
 */
public enum RecoveryVerdict {
    /** Retry the same operation now; any required wait has already happened. */
    RETRY,
    /** Give up on this operation without recording a failure. */
    CONTINUE,
    /** Record the failure and move on to the next iteration. */
    RECORD_AND_CONTINUE,
    /** The worker was cancelled while waiting. */
    CANCELLED
}
