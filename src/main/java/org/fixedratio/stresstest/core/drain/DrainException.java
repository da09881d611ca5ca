package org.fixedratio.stresstest.core.drain;

/**
 * Thrown when a drain cannot even begin: the balance could not be read or the burn failed.
 * Nothing has been burned when this is thrown.
 */
public class DrainException extends RuntimeException {

    public DrainException(String message, Throwable cause) {
        super(message, cause);
    }
}
