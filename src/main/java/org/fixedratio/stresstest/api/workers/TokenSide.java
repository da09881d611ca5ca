package org.fixedratio.stresstest.api.workers;

/**
 * Which token of a pool a deposit or withdrawal worker operates on.
 */
public enum TokenSide {
    A,
    B
}
