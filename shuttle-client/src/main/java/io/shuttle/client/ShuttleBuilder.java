package io.shuttle.client;

import io.shuttle.core.HttpHeaders;
import io.shuttle.core.ProtocolVersion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builder for {@link Shuttle}.
 *
 * <p>If no handler is configured, a {@link NetworkTransport} with default settings is created.
 */
public final class ShuttleBuilder {
    private Transport handler;
    private ProtocolVersion httpVersion = ProtocolVersion.HTTP_1_1;
    private String baseUrl;
    private HttpHeaders headers = HttpHeaders.empty();
    private final List<Middleware> middleware = new ArrayList<>();
    private boolean debug;

    ShuttleBuilder() {
    }

    /**
     * Sets the transport every request ends up at.
     *
     * @param handler the transport to use
     * @return this builder
     */
    public ShuttleBuilder handler(Transport handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
        return this;
    }

    public ShuttleBuilder httpVersion(ProtocolVersion httpVersion) {
        this.httpVersion = Objects.requireNonNull(httpVersion, "httpVersion");
        return this;
    }

    /**
     * @throws io.shuttle.core.ShuttleException.UnknownProtocolVersion if {@code httpVersion} is not
     *         one of 1.0, 1.1 or 2
     */
    public ShuttleBuilder httpVersion(String httpVersion) {
        this.httpVersion = ProtocolVersion.parse(httpVersion);
        return this;
    }

    /**
     * Prefix for string targets. It is concatenated as is, without inserting or removing slashes.
     */
    public ShuttleBuilder baseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
        return this;
    }

    /**
     * Adds a default header sent with every request. Replaces an earlier default of the same name.
     */
    public ShuttleBuilder header(String name, String value) {
        this.headers = headers.with(name, value);
        return this;
    }

    public ShuttleBuilder headers(Map<String, String> headers) {
        Objects.requireNonNull(headers, "headers");
        headers.forEach(this::header);
        return this;
    }

    /**
     * Appends middleware. Middleware run in the order they are added.
     */
    public ShuttleBuilder middleware(Middleware... middleware) {
        return middleware(Arrays.asList(middleware));
    }

    public ShuttleBuilder middleware(List<Middleware> middleware) {
        for (Middleware m : middleware) {
            this.middleware.add(Objects.requireNonNull(m, "middleware"));
        }
        return this;
    }

    public ShuttleBuilder debug(boolean debug) {
        this.debug = debug;
        return this;
    }

    public Shuttle build() {
        Transport resolved = handler;
        if (resolved == null) {
            resolved = NetworkTransport.create();
        }
        return new Shuttle(new ShuttleOptions(resolved, httpVersion, baseUrl, headers, middleware, debug));
    }
}
