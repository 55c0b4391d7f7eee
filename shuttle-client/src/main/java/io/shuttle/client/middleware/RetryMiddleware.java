package io.shuttle.client.middleware;

import io.shuttle.client.Middleware;
import io.shuttle.core.Request;
import io.shuttle.core.Response;
import io.shuttle.core.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Re-sends a request when the rest of the pipeline fails with a {@link TransportException}, or
 * answers with one of the configured retry statuses, up to {@code maxAttempts} attempts in total.
 *
 * <p>A request whose body cannot be read twice is never replayed: the first outcome is returned or
 * thrown as is.
 *
 * <p>Example usage:
 * <pre>{@code
 * Shuttle shuttle = Shuttle.builder()
 *     .middleware(new RetryMiddleware(3, Duration.ofMillis(200), Set.of(503)))
 *     .build();
 * }</pre>
 */
public final class RetryMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(100);

    private final int maxAttempts;
    private final Duration backoff;
    private final Set<Integer> retryStatuses;

    /**
     * Retries transport failures only, with default attempts and backoff.
     */
    public RetryMiddleware() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF, Set.of());
    }

    public RetryMiddleware(int maxAttempts, Duration backoff) {
        this(maxAttempts, backoff, Set.of());
    }

    /**
     * @param maxAttempts   total attempts, including the first
     * @param backoff       fixed pause between attempts
     * @param retryStatuses response statuses that are retried like a transport failure
     */
    public RetryMiddleware(int maxAttempts, Duration backoff, Set<Integer> retryStatuses) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(backoff, "backoff");
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.retryStatuses = Set.copyOf(Objects.requireNonNull(retryStatuses, "retryStatuses"));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public Response process(Request request, Next next) {
        int limit = request.body().isRepeatable() ? maxAttempts : 1;
        int attempt = 1;
        while (true) {
            Response response;
            try {
                response = next.handle(request);
            } catch (TransportException e) {
                if (attempt >= limit) {
                    throw e;
                }
                log.debug("Attempt {}/{} of {} failed: {}", attempt, limit, request, e.getMessage());
                pause(e);
                attempt++;
                continue;
            }
            if (!retryStatuses.contains(response.status()) || attempt >= limit) {
                return response;
            }
            log.debug("Attempt {}/{} of {} answered {}", attempt, limit, request, response.status());
            closeQuietly(response);
            pause(null);
            attempt++;
        }
    }

    private void pause(TransportException pending) {
        if (backoff.isZero()) return;
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            TransportException interrupted = new TransportException("Retry interrupted", e);
            if (pending != null) {
                interrupted.addSuppressed(pending);
            }
            throw interrupted;
        }
    }

    private static void closeQuietly(Response response) {
        try {
            response.body().close();
        } catch (IOException e) {
            log.debug("Failed to release discarded response body", e);
        }
    }
}
