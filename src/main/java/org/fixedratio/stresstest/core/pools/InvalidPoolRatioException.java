package org.fixedratio.stresstest.core.pools;

/**
 * Thrown when a pool ratio violates the anchor-to-one rule.
 */
public class InvalidPoolRatioException extends RuntimeException {

    public InvalidPoolRatioException(String message) {
        super(message);
    }
}
