package io.shuttle.core;

/**
 * Thrown when a transport cannot obtain a response: connection refused, TLS failure, too many
 * redirects, unsupported scheme and so on.
 *
 * <p>An HTTP error status is not a transport failure; it is returned as a normal response.
 */
public class TransportException extends ShuttleException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
