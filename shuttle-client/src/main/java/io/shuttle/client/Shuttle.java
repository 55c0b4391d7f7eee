package io.shuttle.client;

import io.shuttle.core.HttpHeaders;
import io.shuttle.core.Request;
import io.shuttle.core.Response;
import io.shuttle.core.body.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Synchronous HTTP client.
 *
 * <p>Every request travels through the configured middleware, in order, and ends at the
 * {@link Transport}. Responses travel back through the same middleware in reverse order. A client is
 * read-only after construction and may be shared between threads when its handler and middleware
 * allow it.
 *
 * <p>Example usage:
 * <pre>{@code
 * Shuttle shuttle = Shuttle.builder()
 *     .baseUrl("https://api.example.com")
 *     .header("Accept", "application/json")
 *     .middleware(new LoggingMiddleware())
 *     .build();
 *
 * Response response = shuttle.post("/users", new JsonBody(Map.of("name", "Ada")));
 * System.out.println(response.status() + " " + response.body().asString());
 * }</pre>
 */
public final class Shuttle {

    private static final Logger log = LoggerFactory.getLogger(Shuttle.class);

    public static final String USER_AGENT_PREFIX = "Shuttle/1.0";
    public static final String DEFAULT_USER_AGENT = USER_AGENT_PREFIX + " Java/" + System.getProperty("java.version");

    private final ShuttleOptions options;
    private final MiddlewarePipeline pipeline;

    Shuttle(ShuttleOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        Transport handler = options.handler();
        if (options.debug()) {
            handler.setDebug(true);
        }
        this.pipeline = MiddlewarePipeline.compile(options.middleware(), handler::execute);
        log.debug("Created client: handler={}, httpVersion={}, baseUrl={}, middleware={}",
                handler.getClass().getSimpleName(), options.httpVersion(), options.baseUrl(),
                options.middleware().size());
    }

    /**
     * Creates a client over a default {@link NetworkTransport}.
     */
    public static Shuttle create() {
        return builder().build();
    }

    public static Shuttle create(Transport handler) {
        return builder().handler(handler).build();
    }

    /**
     * Creates a client from loosely typed options. See {@link ShuttleOptions#from(Map)} for the keys.
     *
     * @throws io.shuttle.core.ShuttleException.InvalidConfiguration if the options are invalid
     */
    public static Shuttle create(Map<String, ?> options) {
        return new Shuttle(ShuttleOptions.from(options));
    }

    public static ShuttleBuilder builder() {
        return new ShuttleBuilder();
    }

    public Transport handler() {
        return options.handler();
    }

    public ShuttleOptions options() {
        return options;
    }

    /**
     * Sends a fully built request through the middleware pipeline. Errors raised by middleware or
     * the transport reach the caller unchanged.
     */
    public Response sendRequest(Request request) {
        Objects.requireNonNull(request, "request");
        log.debug("Sending {}", request);
        return pipeline.handle(request);
    }

    public Response request(String method, String target) {
        return request(method, target, null, Map.of());
    }

    public Response request(String method, String target, Body body) {
        return request(method, target, body, Map.of());
    }

    /**
     * Builds and sends a request. {@code target} is appended to the configured base URL, if any.
     *
     * @param body    request body, or null for none
     * @param headers per-call headers; they replace defaults of the same name
     */
    public Response request(String method, String target, Body body, Map<String, String> headers) {
        Objects.requireNonNull(target, "target");
        String url = options.baseUrl() == null ? target : options.baseUrl() + target;
        return request(method, URI.create(url), body, headers);
    }

    /**
     * Builds and sends a request to an absolute URI. The base URL is not applied.
     */
    public Response request(String method, URI target, Body body, Map<String, String> headers) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(headers, "headers");
        Body resolvedBody = body == null ? Body.empty() : body;

        HttpHeaders merged = options.headers();
        if (!merged.contains("User-Agent")) {
            merged = merged.with("User-Agent", DEFAULT_USER_AGENT);
        }
        if (resolvedBody.contentType().isPresent()) {
            merged = merged.with("Content-Type", resolvedBody.contentType().get());
        }
        for (Map.Entry<String, String> e : headers.entrySet()) {
            merged = merged.with(e.getKey(), e.getValue());
        }

        Request request = Request.of(method, target)
                .withProtocolVersion(options.httpVersion())
                .withHeaders(merged)
                .withBody(resolvedBody);
        return sendRequest(request);
    }

    public Response get(String target) {
        return request("GET", target);
    }

    public Response get(String target, Map<String, String> headers) {
        return request("GET", target, null, headers);
    }

    public Response delete(String target) {
        return request("DELETE", target);
    }

    public Response delete(String target, Map<String, String> headers) {
        return request("DELETE", target, null, headers);
    }

    public Response head(String target) {
        return request("HEAD", target);
    }

    public Response head(String target, Map<String, String> headers) {
        return request("HEAD", target, null, headers);
    }

    public Response options(String target) {
        return request("OPTIONS", target);
    }

    public Response options(String target, Map<String, String> headers) {
        return request("OPTIONS", target, null, headers);
    }

    public Response post(String target, Body body) {
        return request("POST", target, body);
    }

    public Response post(String target, Body body, Map<String, String> headers) {
        return request("POST", target, body, headers);
    }

    public Response put(String target, Body body) {
        return request("PUT", target, body);
    }

    public Response put(String target, Body body, Map<String, String> headers) {
        return request("PUT", target, body, headers);
    }

    public Response patch(String target, Body body) {
        return request("PATCH", target, body);
    }

    public Response patch(String target, Body body, Map<String, String> headers) {
        return request("PATCH", target, body, headers);
    }
}
