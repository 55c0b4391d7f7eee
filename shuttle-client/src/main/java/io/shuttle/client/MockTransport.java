package io.shuttle.client;

import io.shuttle.core.Request;
import io.shuttle.core.Response;
import io.shuttle.core.ShuttleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Network-free {@link Transport} that replays a queue of prepared responses, for tests.
 *
 * <p>Each queued entry is either a literal {@link Response} or a function computing one from the
 * incoming request. Entries are consumed in FIFO order; a call made after the last entry fails with
 * {@link ShuttleException.QueueExhausted}.
 *
 * <p>Example usage:
 * <pre>{@code
 * MockTransport transport = MockTransport.of(Response.of(200, Body.of("OK")));
 * Shuttle shuttle = Shuttle.builder().handler(transport).build();
 * }</pre>
 *
 * <p>Not thread-safe.
 */
public final class MockTransport implements Transport {

    private final Deque<Function<Request, Response>> queue = new ArrayDeque<>();
    private final List<Request> requests = new ArrayList<>();
    private boolean debug;

    public MockTransport() {
    }

    public static MockTransport of(Response... responses) {
        MockTransport transport = new MockTransport();
        for (Response r : responses) {
            transport.enqueue(r);
        }
        return transport;
    }

    public MockTransport enqueue(Response response) {
        Objects.requireNonNull(response, "response");
        queue.addLast(request -> response);
        return this;
    }

    public MockTransport enqueue(Function<Request, Response> responder) {
        queue.addLast(Objects.requireNonNull(responder, "responder"));
        return this;
    }

    @Override
    public Response execute(Request request) {
        Function<Request, Response> next = queue.pollFirst();
        if (next == null) {
            throw new ShuttleException.QueueExhausted("No more responses available in MockTransport response queue.");
        }
        requests.add(request);
        return next.apply(request);
    }

    @Override
    public MockTransport setDebug(boolean debug) {
        this.debug = debug;
        return this;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * @return number of entries not yet consumed
     */
    public int remaining() {
        return queue.size();
    }

    /**
     * @return requests received so far, oldest first
     */
    public List<Request> requests() {
        return Collections.unmodifiableList(requests);
    }
}
