package org.fixedratio.stresstest.api.chain;

/**
 * Raised by an {@link IChainClient} when a remote call fails. The message carries the raw
 * failure text, which is what the error classifier parses contract error codes from.
 */
public class ChainClientException extends Exception {

    public ChainClientException(String message) {
        super(message);
    }

    public ChainClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
