package io.shuttle.client;

import io.shuttle.core.Request;
import io.shuttle.core.Response;

/**
 * Turns a {@link Request} into a {@link Response}, through real or simulated I/O.
 *
 * <p>This is the innermost stage of every {@link Shuttle} pipeline. Implementations must not keep
 * per-call state between sequential calls; {@link #setDebug(boolean)} is the only configuration
 * mutator.
 *
 * <p>Example usage:
 * <pre>{@code
 * Transport transport = NetworkTransport.create().setDebug(true);
 * Response response = transport.execute(Request.of("GET", "https://example.com"));
 * }</pre>
 */
public interface Transport {

    /**
     * Performs one exchange.
     *
     * <p>An HTTP error status is a successful exchange and is returned, not thrown.
     *
     * @param request the request to send
     * @return the response
     * @throws io.shuttle.core.TransportException if no response could be obtained
     */
    Response execute(Request request);

    /**
     * Enables or disables verbose diagnostics.
     *
     * @return this transport, for chaining
     */
    Transport setDebug(boolean debug);
}
