package io.shuttle.core;

/**
 * Base class for Shuttle related exceptions.
 *
 * <p>All Shuttle failures are unchecked so that middleware and transports can be written as plain
 * lambdas. Subclasses identify the failure; the original cause is preserved when there is one.
 */
public abstract class ShuttleException extends RuntimeException {

    protected ShuttleException(String message) {
        super(message);
    }

    protected ShuttleException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised while building a client when an option is missing, unknown or of the wrong type.
     * Never retryable.
     */
    public static class InvalidConfiguration extends ShuttleException {
        public InvalidConfiguration(String message) {
            super(message);
        }
    }

    /**
     * Raised when a protocol version outside of 1.0, 1.1 and 2 is requested.
     */
    public static class UnknownProtocolVersion extends InvalidConfiguration {
        private final String version;

        public UnknownProtocolVersion(String version) {
            super("Unknown HTTP protocol version: " + version);
            this.version = version;
        }

        public String version() {
            return version;
        }
    }

    /**
     * Raised by the scripted transport when it is asked for more responses than were queued.
     */
    public static class QueueExhausted extends ShuttleException {
        public QueueExhausted(String message) {
            super(message);
        }
    }
}
