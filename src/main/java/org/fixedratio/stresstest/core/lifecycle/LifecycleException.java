package org.fixedratio.stresstest.core.lifecycle;

/**
 * Thrown when the system cannot be started.
 */
public class LifecycleException extends RuntimeException {

    public LifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
