package io.shuttle.core;

import io.shuttle.core.body.Body;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Inbound HTTP response. This is an immutable value type: every {@code with*} method returns a new
 * instance.
 *
 * <p>Status code and reason phrase only change together through {@link #withStatus(int, String)}, so
 * the pair is never inconsistent. When no phrase is given it is looked up in {@link ReasonPhrases}.
 */
public final class Response {

    private final int status;
    private final String reasonPhrase;
    private final ProtocolVersion version;
    private final HttpHeaders headers;
    private final Body body;

    private Response(int status, String reasonPhrase, ProtocolVersion version, HttpHeaders headers, Body body) {
        this.status = validateStatus(status);
        this.reasonPhrase = reasonPhrase == null || reasonPhrase.isEmpty() ? ReasonPhrases.lookup(status) : reasonPhrase;
        this.version = Objects.requireNonNull(version, "version");
        this.headers = headers == null ? HttpHeaders.empty() : headers;
        this.body = body == null ? Body.empty() : body;
    }

    public static Response of(int status) {
        return new Response(status, null, ProtocolVersion.HTTP_1_1, HttpHeaders.empty(), null);
    }

    public static Response of(int status, Body body) {
        return new Response(status, null, ProtocolVersion.HTTP_1_1, HttpHeaders.empty(), body);
    }

    public static Response of(int status, Body body, Map<String, String> headers) {
        return new Response(status, null, ProtocolVersion.HTTP_1_1, HttpHeaders.of(headers), body);
    }

    public static Response of(int status, Body body, Map<String, String> headers, ProtocolVersion version) {
        return new Response(status, null, version, HttpHeaders.of(headers), body);
    }

    /**
     * Creates a response with every field given explicitly; used by transports.
     */
    public static Response of(int status, String reasonPhrase, ProtocolVersion version, HttpHeaders headers, Body body) {
        return new Response(status, reasonPhrase, version, headers, body);
    }

    public int status() { return status; }
    public String reasonPhrase() { return reasonPhrase; }
    public ProtocolVersion protocolVersion() { return version; }
    public HttpHeaders headers() { return headers; }
    public Body body() { return body; }

    /**
     * @return true for 1xx, 2xx and 3xx status codes
     */
    public boolean isSuccessful() {
        return status >= 100 && status < 400;
    }

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

    public Response withStatus(int status) {
        return new Response(status, null, version, headers, body);
    }

    public Response withStatus(int status, String reasonPhrase) {
        return new Response(status, reasonPhrase, version, headers, body);
    }

    public Response withProtocolVersion(ProtocolVersion version) {
        return new Response(status, reasonPhrase, version, headers, body);
    }

    public Response withHeader(String name, String value) {
        return new Response(status, reasonPhrase, version, headers.with(name, value), body);
    }

    public Response withAddedHeader(String name, String value) {
        return new Response(status, reasonPhrase, version, headers.withAdded(name, value), body);
    }

    public Response withoutHeader(String name) {
        return new Response(status, reasonPhrase, version, headers.without(name), body);
    }

    public Response withBody(Body body) {
        return new Response(status, reasonPhrase, version, headers, body);
    }

    private static int validateStatus(int status) {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status code out of range [100, 599]: " + status);
        }
        return status;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Response)) return false;
        Response r = (Response) other;
        return status == r.status
                && reasonPhrase.equals(r.reasonPhrase)
                && version == r.version
                && headers.equals(r.headers)
                && body.equals(r.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, reasonPhrase, version, headers, body);
    }

    @Override
    public String toString() {
        return "HTTP/" + version + " " + status + (reasonPhrase.isEmpty() ? "" : " " + reasonPhrase);
    }
}
