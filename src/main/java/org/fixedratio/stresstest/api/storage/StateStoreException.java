package org.fixedratio.stresstest.api.storage;

/**
 * Thrown when the state store cannot read or write its backing storage.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
