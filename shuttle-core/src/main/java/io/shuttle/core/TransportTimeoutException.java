package io.shuttle.core;

/**
 * Thrown when a transport gives up waiting on the network.
 * Allows callers to distinguish timeouts from other transport failures.
 */
public class TransportTimeoutException extends TransportException {

    public TransportTimeoutException(String message) {
        super(message);
    }

    public TransportTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
