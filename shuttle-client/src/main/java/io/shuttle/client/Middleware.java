package io.shuttle.client;

import io.shuttle.core.Request;
import io.shuttle.core.Response;

/**
 * Request/response interceptor.
 *
 * <p>A middleware receives the request together with {@code next}, the rest of the pipeline. It
 * decides whether to call {@code next}, how many times, and with which request; it may also replace
 * the response on its way back. Not calling {@code next} short-circuits every later middleware and
 * the transport.
 *
 * <p>Example usage:
 * <pre>{@code
 * Middleware auth = (request, next) -> next.handle(request.withHeader("Authorization", "Bearer " + token));
 * }</pre>
 */
@FunctionalInterface
public interface Middleware {

    Response process(Request request, Next next);

    /**
     * The remainder of a pipeline, ending in {@link Transport#execute(Request)}.
     */
    @FunctionalInterface
    interface Next {
        Response handle(Request request);
    }
}
