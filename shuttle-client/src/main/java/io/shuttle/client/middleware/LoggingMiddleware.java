package io.shuttle.client.middleware;

import io.shuttle.client.Middleware;
import io.shuttle.core.Request;
import io.shuttle.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Logs one line per request and one per response at INFO, and failures at WARN.
 *
 * <pre>
 * --&gt; GET https://example.com/users
 * &lt;-- 200 OK (42 ms)
 * </pre>
 */
public final class LoggingMiddleware implements Middleware {

    private final Logger log;

    public LoggingMiddleware() {
        this(LoggerFactory.getLogger(LoggingMiddleware.class));
    }

    public LoggingMiddleware(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public Response process(Request request, Next next) {
        log.info("--> {} {}", request.method(), request.uri());
        long start = System.nanoTime();
        try {
            Response response = next.handle(request);
            log.info("<-- {} {} ({} ms)", response.status(), response.reasonPhrase(), elapsedMillis(start));
            return response;
        } catch (RuntimeException e) {
            log.warn("<-- {} {} failed after {} ms: {}", request.method(), request.uri(), elapsedMillis(start), e.toString());
            throw e;
        }
    }

    private static long elapsedMillis(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
