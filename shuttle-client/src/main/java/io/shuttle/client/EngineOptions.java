package io.shuttle.client;

import io.shuttle.core.HttpHeaders;
import io.shuttle.core.body.Body;
import org.apache.hc.core5.http.HttpVersion;
import org.apache.hc.core5.http2.HttpVersionPolicy;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything {@link NetworkTransport} hands to the HTTP engine for one exchange.
 *
 * <p>Computed by {@link NetworkTransport#buildOptions(io.shuttle.core.Request)} as a pure function
 * of the request and the transport settings, freshly for every call.
 *
 * @param method          explicit request method
 * @param url             absolute URL with explicit port and a non-empty path
 * @param port            the port {@code url} points at
 * @param version         engine protocol version constant
 * @param versionPolicy   engine version negotiation policy
 * @param headers         request headers in declared order and casing
 * @param body            request body, or null when the body channel is left unset
 * @param followRedirects whether redirects are followed
 * @param maxRedirects    redirect limit when following
 * @param connectTimeout  connect timeout
 * @param verifyPeer      whether the TLS peer certificate and host name are verified
 * @param protocols       URL schemes the engine may use
 * @param verbose         whether the debug trace is written
 */
public record EngineOptions(
        String method,
        URI url,
        int port,
        HttpVersion version,
        HttpVersionPolicy versionPolicy,
        HttpHeaders headers,
        Body body,
        boolean followRedirects,
        int maxRedirects,
        Duration connectTimeout,
        boolean verifyPeer,
        Set<String> protocols,
        boolean verbose
) {
    public EngineOptions {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(versionPolicy, "versionPolicy");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (headers == null) {
            headers = HttpHeaders.empty();
        }
        protocols = protocols == null ? Set.of() : Set.copyOf(protocols);
    }

    /**
     * @return wire form header lines, {@code "Name: value"}, one per value
     */
    public List<String> headerLines() {
        return headers.lines();
    }

    public boolean hasBody() {
        return body != null;
    }
}
