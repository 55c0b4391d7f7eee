package io.shuttle.client.middleware;

import io.shuttle.client.Middleware;
import io.shuttle.core.Request;
import io.shuttle.core.Response;
import io.shuttle.core.TransportException;
import io.shuttle.core.body.Body;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryMiddlewareTest {

    private static final Request GET = Request.of("GET", "http://example.com");

    @Test
    void retriesTransportFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        Middleware.Next next = request -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransportException("connection reset");
            }
            return Response.of(200);
        };

        Response response = new RetryMiddleware(3, Duration.ZERO).process(GET, next);

        assertThat(response.status()).isEqualTo(200);
        assertThat(calls).hasValue(3);
    }

    @Test
    void rethrowsLastFailureWhenAttemptsRunOut() {
        AtomicInteger calls = new AtomicInteger();
        Middleware.Next next = request -> {
            throw new TransportException("attempt " + calls.incrementAndGet());
        };

        assertThatThrownBy(() -> new RetryMiddleware(2, Duration.ZERO).process(GET, next))
                .isInstanceOf(TransportException.class)
                .hasMessage("attempt 2");
    }

    @Test
    void retriesConfiguredStatuses() {
        Deque<Response> responses = new ArrayDeque<>();
        responses.add(Response.of(503));
        responses.add(Response.of(503));
        responses.add(Response.of(200));

        Response response = new RetryMiddleware(5, Duration.ofMillis(1), Set.of(503))
                .process(GET, request -> responses.poll());

        assertThat(response.status()).isEqualTo(200);
        assertThat(responses).isEmpty();
    }

    @Test
    void returnsLastRetryableStatusWhenAttemptsRunOut() {
        AtomicInteger calls = new AtomicInteger();

        Response response = new RetryMiddleware(2, Duration.ZERO, Set.of(429))
                .process(GET, request -> {
                    calls.incrementAndGet();
                    return Response.of(429);
                });

        assertThat(response.status()).isEqualTo(429);
        assertThat(calls).hasValue(2);
    }

    @Test
    void neverReplaysOneShotBody() {
        AtomicInteger calls = new AtomicInteger();
        Request upload = Request.of("POST", "http://example.com")
                .withBody(Body.of(new ByteArrayInputStream(new byte[]{1, 2, 3})));

        assertThatThrownBy(() -> new RetryMiddleware(3, Duration.ZERO).process(upload, request -> {
            calls.incrementAndGet();
            throw new TransportException("broken pipe");
        })).isInstanceOf(TransportException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void otherFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> new RetryMiddleware().process(GET, request -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryMiddleware(0, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryMiddleware(1, Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
        assertThat(new RetryMiddleware().maxAttempts()).isEqualTo(RetryMiddleware.DEFAULT_MAX_ATTEMPTS);
    }
}
