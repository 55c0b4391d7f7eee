package io.shuttle.core;

import io.shuttle.core.body.Body;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outbound HTTP request. This is an immutable value type: every {@code with*} method returns a new
 * instance and leaves the receiver untouched.
 *
 * <p>Example usage:
 * <pre>{@code
 * Request request = Request.of("post", "https://api.example.com/books", new JsonBody(book))
 *         .withHeader("Authorization", "Bearer " + token);
 * }</pre>
 */
public final class Request {

    private final String method;
    private final URI uri;
    private final ProtocolVersion version;
    private final HttpHeaders headers;
    private final Body body;

    private Request(String method, URI uri, ProtocolVersion version, HttpHeaders headers, Body body) {
        this.method = normalizeMethod(method);
        this.uri = Objects.requireNonNull(uri, "uri");
        this.version = Objects.requireNonNull(version, "version");
        this.headers = headers == null ? HttpHeaders.empty() : headers;
        this.body = body == null ? Body.empty() : body;
    }

    public static Request of(String method, URI uri) {
        return new Request(method, uri, ProtocolVersion.HTTP_1_1, HttpHeaders.empty(), null);
    }

    public static Request of(String method, String uri) {
        return of(method, URI.create(uri));
    }

    public static Request of(String method, String uri, Body body) {
        return of(method, URI.create(uri)).withBody(body);
    }

    public static Request of(String method, URI uri, Body body, Map<String, String> headers) {
        return new Request(method, uri, ProtocolVersion.HTTP_1_1, HttpHeaders.of(headers), body);
    }

    public String method() { return method; }
    public URI uri() { return uri; }
    public ProtocolVersion protocolVersion() { return version; }
    public HttpHeaders headers() { return headers; }
    public Body body() { return body; }

    public boolean hasHeader(String name) {
        return headers.contains(name);
    }

    public List<String> header(String name) {
        return headers.values(name);
    }

    public Optional<String> firstHeader(String name) {
        return headers.firstValue(name);
    }

    public String headerLine(String name) {
        return headers.line(name);
    }

    public Request withMethod(String method) {
        return new Request(method, uri, version, headers, body);
    }

    public Request withUri(URI uri) {
        return new Request(method, uri, version, headers, body);
    }

    public Request withProtocolVersion(ProtocolVersion version) {
        return new Request(method, uri, version, headers, body);
    }

    /**
     * @throws ShuttleException.UnknownProtocolVersion if {@code version} is not 1.0, 1.1 or 2
     */
    public Request withProtocolVersion(String version) {
        return withProtocolVersion(ProtocolVersion.parse(version));
    }

    public Request withHeader(String name, String value) {
        return new Request(method, uri, version, headers.with(name, value), body);
    }

    public Request withHeader(String name, List<String> values) {
        return new Request(method, uri, version, headers.with(name, values), body);
    }

    public Request withAddedHeader(String name, String value) {
        return new Request(method, uri, version, headers.withAdded(name, value), body);
    }

    public Request withoutHeader(String name) {
        return new Request(method, uri, version, headers.without(name), body);
    }

    public Request withHeaders(HttpHeaders headers) {
        return new Request(method, uri, version, headers, body);
    }

    public Request withBody(Body body) {
        return new Request(method, uri, version, headers, body);
    }

    private static String normalizeMethod(String method) {
        Objects.requireNonNull(method, "method");
        String m = method.trim();
        if (m.isEmpty()) {
            throw new IllegalArgumentException("method must not be empty");
        }
        for (int i = 0; i < m.length(); i++) {
            char c = m.charAt(i);
            if (c <= ' ' || c >= 127 || "()<>@,;:\\\"/[]?={}".indexOf(c) >= 0) {
                throw new IllegalArgumentException("method is not a valid token: " + method);
            }
        }
        return m.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return method + " " + uri + " HTTP/" + version;
    }
}
