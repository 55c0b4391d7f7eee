package io.shuttle.client;

import io.shuttle.core.ProtocolVersion;
import io.shuttle.core.Request;
import io.shuttle.core.Response;
import io.shuttle.core.ShuttleException;
import io.shuttle.core.TransportException;
import io.shuttle.core.TransportTimeoutException;
import io.shuttle.core.body.SpillBuffer;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.async.CloseableHttpAsyncClient;
import org.apache.hc.client5.http.impl.async.HttpAsyncClientBuilder;
import org.apache.hc.client5.http.impl.async.HttpAsyncClients;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManager;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.ClientTlsStrategyBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpVersion;
import org.apache.hc.core5.http.nio.AsyncRequestProducer;
import org.apache.hc.core5.http.nio.entity.AsyncEntityProducers;
import org.apache.hc.core5.http.nio.ssl.TlsStrategy;
import org.apache.hc.core5.http.nio.support.AsyncRequestBuilder;
import org.apache.hc.core5.http2.HttpVersionPolicy;
import org.apache.hc.core5.reactor.IOReactorConfig;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * {@link Transport} performing real network exchanges with Apache HttpClient 5.
 *
 * <p>Every call computes its {@link EngineOptions} with {@link #buildOptions(Request)}, runs on an
 * engine instance built for that call alone, and closes the engine afterwards. Nothing is pooled or
 * shared between calls, so one transport may serve concurrent callers.
 *
 * <p>Response bodies are streamed into a {@link SpillBuffer}: they stay in memory up to
 * {@link #maxResponseBodyMemory()} bytes (2 MiB by default) and move to a temporary file beyond that.
 *
 * <p>Defaults: redirects followed up to 10 hops, 120 second connect timeout, TLS peer verification
 * on, {@code http} and {@code https} only. The engine never retries and keeps no cookies.
 */
public final class NetworkTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(NetworkTransport.class);

    public static final int DEFAULT_MAX_REDIRECTS = 10;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(120);
    public static final Set<String> PROTOCOLS = Set.of("http", "https");

    private static final Set<String> BODYLESS_METHODS = Set.of("GET", "HEAD", "TRACE");
    // Message framing is computed by the engine from the body.
    private static final Set<String> FRAMING_HEADERS = Set.of("content-length", "transfer-encoding");

    private final boolean followRedirects;
    private final int maxRedirects;
    private final Duration connectTimeout;
    private final boolean verifyPeer;
    private final PrintStream debugOutput;

    private volatile boolean debug;
    private volatile long maxResponseBodyMemory;

    private NetworkTransport(Builder builder) {
        this.followRedirects = builder.followRedirects;
        this.maxRedirects = builder.maxRedirects;
        this.connectTimeout = builder.connectTimeout;
        this.verifyPeer = builder.verifyPeer;
        this.debugOutput = builder.debugOutput;
        this.debug = builder.debug;
        this.maxResponseBodyMemory = builder.maxResponseBodyMemory;
    }

    /**
     * Creates a transport with default settings.
     * @return a new NetworkTransport
     */
    public static NetworkTransport create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Response execute(Request request) {
        EngineOptions options = buildOptions(request);
        DebugTrace trace = options.verbose() ? DebugTrace.to(debugOutput) : DebugTrace.disabled();
        trace.info("Trying " + options.url());
        log.debug("Dispatching {} {} (HTTP/{})", options.method(), options.url(), request.protocolVersion());

        AsyncRequestProducer producer = toRequestProducer(options);
        ResponseAssembler assembler = new ResponseAssembler(newResponseBuffer(), request.protocolVersion());

        try (CloseableHttpAsyncClient engine = newEngine(options, trace)) {
            engine.start();
            Future<Response> future = engine.execute(producer, assembler, null);
            Response response = future.get();
            trace.info("Completed with status " + response.status());
            return response;
        } catch (ExecutionException e) {
            throw failure(options, e.getCause() == null ? e : e.getCause(), trace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request interrupted", e);
        } catch (IOException e) {
            throw failure(options, e, trace);
        }
    }

    /**
     * Computes the engine options for {@code request}. Pure: reads only the request and this
     * transport's settings, and never touches the request body.
     *
     * @throws TransportException if the URL scheme is not {@code http} or {@code https}, or the
     *                            URL has no host
     */
    public EngineOptions buildOptions(Request request) {
        Objects.requireNonNull(request, "request");
        URI url = absoluteUrl(request.uri());
        boolean carriesBody = !BODYLESS_METHODS.contains(request.method())
                && request.body().contentLength() != 0;

        return new EngineOptions(
                request.method(),
                url,
                url.getPort(),
                engineVersion(request.protocolVersion()),
                versionPolicy(request.protocolVersion()),
                request.headers(),
                carriesBody ? request.body() : null,
                followRedirects,
                maxRedirects,
                connectTimeout,
                verifyPeer,
                PROTOCOLS,
                debug);
    }

    /**
     * Maps a protocol version to the engine's constant.
     */
    public static HttpVersion engineVersion(ProtocolVersion version) {
        if (version == null) {
            throw new ShuttleException.UnknownProtocolVersion(null);
        }
        switch (version) {
            case HTTP_1_0:
                return HttpVersion.HTTP_1_0;
            case HTTP_1_1:
                return HttpVersion.HTTP_1_1;
            case HTTP_2:
                return HttpVersion.HTTP_2;
            default:
                throw new ShuttleException.UnknownProtocolVersion(version.value());
        }
    }

    /**
     * HTTP/2 is attempted through negotiation and falls back to 1.1; 1.x is forced.
     */
    static HttpVersionPolicy versionPolicy(ProtocolVersion version) {
        return version == ProtocolVersion.HTTP_2 ? HttpVersionPolicy.NEGOTIATE : HttpVersionPolicy.FORCE_HTTP_1;
    }

    /**
     * @return the buffer the next call will stream its response body into
     */
    public SpillBuffer newResponseBuffer() {
        return new SpillBuffer(maxResponseBodyMemory);
    }

    /**
     * Sets how many response body bytes are kept in memory before spilling to a temporary file.
     * @return this transport
     */
    public NetworkTransport setMaxResponseBodyMemory(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must be >= 0");
        }
        this.maxResponseBodyMemory = bytes;
        return this;
    }

    public long maxResponseBodyMemory() {
        return maxResponseBodyMemory;
    }

    @Override
    public NetworkTransport setDebug(boolean debug) {
        this.debug = debug;
        return this;
    }

    public boolean isDebug() {
        return debug;
    }

    static URI absoluteUrl(URI uri) {
        String scheme = uri.getScheme();
        if (scheme == null) {
            throw new TransportException("URL has no scheme: " + uri);
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!PROTOCOLS.contains(scheme)) {
            throw new TransportException("Protocol \"" + scheme + "\" not supported");
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new TransportException("URL has no host: " + uri);
        }
        int port = uri.getPort() != -1 ? uri.getPort() : ("https".equals(scheme) ? 443 : 80);
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();

        StringBuilder sb = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            sb.append(uri.getRawUserInfo()).append('@');
        }
        sb.append(host).append(':').append(port).append(path);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return URI.create(sb.toString());
    }

    private static AsyncRequestProducer toRequestProducer(EngineOptions options) {
        AsyncRequestBuilder builder = AsyncRequestBuilder.create(options.method()).setUri(options.url());
        if (options.version().lessEquals(HttpVersion.HTTP_1_1)) {
            builder.setVersion(options.version());
        }

        for (Map.Entry<String, List<String>> e : options.headers().toMap().entrySet()) {
            if (FRAMING_HEADERS.contains(e.getKey().toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (String value : e.getValue()) {
                builder.addHeader(e.getKey(), value);
            }
        }

        if (options.hasBody()) {
            byte[] bytes;
            try {
                // Held in memory so the engine can replay it on a 307/308 redirect.
                bytes = options.body().readAllBytes();
            } catch (UncheckedIOException e) {
                throw new TransportException("Failed to read request body", e.getCause());
            }
            String contentType = options.headers().firstValue("Content-Type").orElse(null);
            builder.setEntity(AsyncEntityProducers.create(bytes,
                    contentType == null ? null : ContentType.parseLenient(contentType)));
        } else if (!BODYLESS_METHODS.contains(options.method())) {
            // Empty entity so methods that define a body announce Content-Length: 0.
            builder.setEntity(AsyncEntityProducers.create(new byte[0], (ContentType) null));
        }
        return builder.build();
    }

    private static CloseableHttpAsyncClient newEngine(EngineOptions options, DebugTrace trace) {
        PoolingAsyncClientConnectionManager connections = PoolingAsyncClientConnectionManagerBuilder.create()
                .setTlsStrategy(tlsStrategy(options.verifyPeer()))
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(options.connectTimeout().toMillis()))
                        .build())
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setRedirectsEnabled(options.followRedirects())
                .setMaxRedirects(options.maxRedirects())
                .setCircularRedirectsAllowed(true)
                .build();

        HttpAsyncClientBuilder builder = HttpAsyncClients.custom()
                .setConnectionManager(connections)
                .setVersionPolicy(options.versionPolicy())
                .setDefaultRequestConfig(requestConfig)
                .setIOReactorConfig(IOReactorConfig.custom().setIoThreadCount(1).build())
                .disableAutomaticRetries()
                .disableCookieManagement();

        if (trace.enabled()) {
            builder.addRequestInterceptorLast((request, entity, context) -> trace.requestHead(request, context));
            builder.addResponseInterceptorFirst((response, entity, context) -> trace.responseHead(response, context));
        }
        return builder.build();
    }

    private static TlsStrategy tlsStrategy(boolean verifyPeer) {
        if (verifyPeer) {
            return ClientTlsStrategyBuilder.create().useSystemProperties().build();
        }
        try {
            SSLContext context = SSLContexts.custom().loadTrustMaterial(TrustAllStrategy.INSTANCE).build();
            return ClientTlsStrategyBuilder.create()
                    .setSslContext(context)
                    .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                    .build();
        } catch (GeneralSecurityException e) {
            throw new TransportException("Failed to set up TLS without peer verification", e);
        }
    }

    private static TransportException failure(EngineOptions options, Throwable cause, DebugTrace trace) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        trace.info("Failed: " + message);
        log.debug("{} {} failed", options.method(), options.url(), cause);

        if (cause instanceof TransportException) {
            return (TransportException) cause;
        }
        if (cause instanceof SocketTimeoutException || cause instanceof ConnectTimeoutException) {
            return new TransportTimeoutException(message, cause);
        }
        return new TransportException(message, cause);
    }

    /**
     * Settings for a {@link NetworkTransport}.
     */
    public static final class Builder {
        private boolean followRedirects = true;
        private int maxRedirects = DEFAULT_MAX_REDIRECTS;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private boolean verifyPeer = true;
        private boolean debug;
        private PrintStream debugOutput = System.err;
        private long maxResponseBodyMemory = SpillBuffer.DEFAULT_THRESHOLD;

        private Builder() {
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            if (maxRedirects < 0) {
                throw new IllegalArgumentException("maxRedirects must be >= 0");
            }
            this.maxRedirects = maxRedirects;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            Objects.requireNonNull(connectTimeout, "connectTimeout");
            if (connectTimeout.isNegative()) {
                throw new IllegalArgumentException("connectTimeout must not be negative");
            }
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder verifyPeer(boolean verifyPeer) {
            this.verifyPeer = verifyPeer;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        /**
         * Side channel for the debug trace. Defaults to {@code System.err}.
         */
        public Builder debugOutput(PrintStream debugOutput) {
            this.debugOutput = Objects.requireNonNull(debugOutput, "debugOutput");
            return this;
        }

        public Builder maxResponseBodyMemory(long bytes) {
            if (bytes < 0) {
                throw new IllegalArgumentException("bytes must be >= 0");
            }
            this.maxResponseBodyMemory = bytes;
            return this;
        }

        public NetworkTransport build() {
            return new NetworkTransport(this);
        }
    }
}
