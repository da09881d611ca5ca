package org.fixedratio.stresstest.core.errors;

/**
 * Coarse recovery class of an error kind.
 */
public enum ErrorCategory {
    /** Recovered automatically by waiting or adjusting parameters. */
    TRANSIENT_RETRYABLE,
    /** Recovered after a corrective action such as a token refill. */
    TRANSIENT_WITH_SIDE_EFFECT,
    /** A configuration defect; retrying cannot help. */
    FATAL_CONFIGURATION,
    /** Not understood; retried a small fixed number of times. */
    UNKNOWN_BOUNDED
}
