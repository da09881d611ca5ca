package org.fixedratio.stresstest.core.errors;

/**
 * Error kinds that have a dedicated recovery policy.
 */
public enum ErrorKind {
    INSUFFICIENT_FUNDS(ErrorCategory.TRANSIENT_WITH_SIDE_EFFECT),
    POOL_PAUSED(ErrorCategory.TRANSIENT_RETRYABLE),
    SYSTEM_PAUSED(ErrorCategory.TRANSIENT_RETRYABLE),
    INSUFFICIENT_LIQUIDITY(ErrorCategory.TRANSIENT_RETRYABLE),
    SLIPPAGE_EXCEEDED(ErrorCategory.TRANSIENT_RETRYABLE),
    INVALID_TOKEN_ACCOUNT(ErrorCategory.FATAL_CONFIGURATION),
    INVALID_LP_TOKEN_TYPE(ErrorCategory.FATAL_CONFIGURATION),
    POOL_SWAPS_PAUSED(ErrorCategory.TRANSIENT_RETRYABLE),
    UNKNOWN(ErrorCategory.UNKNOWN_BOUNDED);

    private final ErrorCategory category;

    ErrorKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
