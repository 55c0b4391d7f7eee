package io.shuttle.client;

import io.shuttle.core.ProtocolVersion;
import io.shuttle.core.Request;
import io.shuttle.core.Response;
import io.shuttle.core.TransportException;
import io.shuttle.core.body.Body;
import io.shuttle.core.body.SpillBuffer;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apache.hc.core5.http.HttpVersion;
import org.apache.hc.core5.http2.HttpVersionPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetworkTransportTest {

    private MockWebServer server;
    private NetworkTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        transport = NetworkTransport.builder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void buildOptionsMapsRequest() {
        Request request = Request.of("POST", "http://example.com?q=1")
                .withHeader("X-B", "2")
                .withHeader("x-a", "1")
                .withAddedHeader("X-B", "3")
                .withBody(Body.of("payload"));

        EngineOptions options = transport.buildOptions(request);

        assertThat(options.method()).isEqualTo("POST");
        assertThat(options.url()).isEqualTo(URI.create("http://example.com:80/?q=1"));
        assertThat(options.port()).isEqualTo(80);
        assertThat(options.version()).isEqualTo(HttpVersion.HTTP_1_1);
        assertThat(options.versionPolicy()).isEqualTo(HttpVersionPolicy.FORCE_HTTP_1);
        assertThat(options.headerLines()).containsExactly("X-B: 2", "X-B: 3", "x-a: 1");
        assertThat(options.hasBody()).isTrue();
        assertThat(options.followRedirects()).isTrue();
        assertThat(options.maxRedirects()).isEqualTo(NetworkTransport.DEFAULT_MAX_REDIRECTS);
        assertThat(options.connectTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.verifyPeer()).isTrue();
        assertThat(options.protocols()).containsExactlyInAnyOrder("http", "https");
        assertThat(options.verbose()).isFalse();
    }

    @Test
    void buildOptionsMapsProtocolVersions() {
        Request request = Request.of("GET", "https://example.com/a");

        EngineOptions v10 = transport.buildOptions(request.withProtocolVersion(ProtocolVersion.HTTP_1_0));
        EngineOptions v2 = transport.buildOptions(request.withProtocolVersion(ProtocolVersion.HTTP_2));

        assertThat(v10.version()).isEqualTo(HttpVersion.HTTP_1_0);
        assertThat(v10.versionPolicy()).isEqualTo(HttpVersionPolicy.FORCE_HTTP_1);
        assertThat(v2.version()).isEqualTo(HttpVersion.HTTP_2);
        assertThat(v2.versionPolicy()).isEqualTo(HttpVersionPolicy.NEGOTIATE);
        assertThat(v2.port()).isEqualTo(443);
    }

    @Test
    void buildOptionsOmitsBodyForBodylessMethodsAndEmptyBodies() {
        Body body = Body.of("ignored");

        assertThat(transport.buildOptions(Request.of("GET", "http://example.com", body)).hasBody()).isFalse();
        assertThat(transport.buildOptions(Request.of("HEAD", "http://example.com", body)).hasBody()).isFalse();
        assertThat(transport.buildOptions(Request.of("TRACE", "http://example.com", body)).hasBody()).isFalse();
        assertThat(transport.buildOptions(Request.of("POST", "http://example.com")).hasBody()).isFalse();
        assertThat(transport.buildOptions(Request.of("DELETE", "http://example.com", body)).hasBody()).isTrue();
    }

    @Test
    void buildOptionsReflectsDebugFlag() {
        transport.setDebug(true);

        assertThat(transport.isDebug()).isTrue();
        assertThat(transport.buildOptions(Request.of("GET", "http://example.com")).verbose()).isTrue();
    }

    @Test
    void rejectsUnsupportedScheme() {
        assertThatThrownBy(() -> transport.execute(Request.of("GET", "ftp://example.com/file")))
                .isInstanceOf(TransportException.class)
                .hasMessage("Protocol \"ftp\" not supported");
        assertThatThrownBy(() -> transport.buildOptions(Request.of("GET", "/relative")))
                .isInstanceOf(TransportException.class);
    }

    @Test
    void getSendsNoBodyAndReturnsResponse() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/plain")
                .addHeader("X-Multi", "a")
                .addHeader("X-Multi", "b")
                .setBody("hello"));

        Response response = transport.execute(Request.of("GET", server.url("/greeting?lang=en").uri())
                .withHeader("Accept", "text/plain")
                .withBody(Body.of("should not be sent")));

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.reasonPhrase()).isEqualTo("OK");
        assertThat(response.protocolVersion()).isEqualTo(ProtocolVersion.HTTP_1_1);
        assertThat(response.body().asString()).isEqualTo("hello");
        assertThat(response.body().contentType()).contains("text/plain");
        assertThat(response.header("x-multi")).containsExactly("a", "b");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/greeting?lang=en");
        assertThat(recorded.getHeader("Accept")).isEqualTo("text/plain");
        assertThat(recorded.getBodySize()).isZero();
        assertThat(recorded.getHeader("Content-Length")).isNull();
    }

    @Test
    void emptyPostAnnouncesZeroLength() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        Response response = transport.execute(Request.of("POST", server.url("/empty").uri()));

        assertThat(response.status()).isEqualTo(204);
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getHeader("Content-Length")).isEqualTo("0");
        assertThat(recorded.getHeader("Transfer-Encoding")).isNull();
        assertThat(recorded.getBodySize()).isZero();
    }

    @Test
    void postSendsBodyWithComputedFraming() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        Response response = transport.execute(Request.of("POST", server.url("/items").uri())
                .withHeader("Content-Type", "application/json")
                .withHeader("Content-Length", "999")
                .withBody(Body.of("{\"a\":1}")));

        assertThat(response.status()).isEqualTo(201);
        assertThat(response.body().contentLength()).isZero();

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"a\":1}");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(recorded.getHeader("Content-Length")).isEqualTo("7");
    }

    @Test
    void errorStatusIsReturnedNotThrown() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));

        Response response = transport.execute(Request.of("GET", server.url("/nope").uri()));

        assertThat(response.status()).isEqualTo(404);
        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.body().asString()).isEqualTo("missing");
    }

    @Test
    void followsRedirects() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(302).addHeader("Location", "/final"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("done"));

        Response response = transport.execute(Request.of("GET", server.url("/start").uri()));

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body().asString()).isEqualTo("done");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/start");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/final");
    }

    @Test
    void redirectLimitFailsTheCall() {
        NetworkTransport limited = NetworkTransport.builder().maxRedirects(1).build();
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(302).addHeader("Location", "/hop" + i));
        }

        assertThatThrownBy(() -> limited.execute(Request.of("GET", server.url("/start").uri())))
                .isInstanceOf(TransportException.class);
    }

    @Test
    void redirectsCanBeDisabled() {
        NetworkTransport manual = NetworkTransport.builder().followRedirects(false).build();
        server.enqueue(new MockResponse().setResponseCode(302).addHeader("Location", "/final"));

        Response response = manual.execute(Request.of("GET", server.url("/start").uri()));

        assertThat(response.status()).isEqualTo(302);
        assertThat(response.headerLine("Location")).isEqualTo("/final");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void http2FallsBackToHttp11OnPlainServer() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        Response response = transport.execute(Request.of("GET", server.url("/").uri())
                .withProtocolVersion(ProtocolVersion.HTTP_2));

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.protocolVersion()).isEqualTo(ProtocolVersion.HTTP_1_1);
    }

    @Test
    void connectionFailureBecomesTransportException() throws Exception {
        URI closed = server.url("/").uri();
        server.shutdown();

        assertThatThrownBy(() -> transport.execute(Request.of("GET", closed)))
                .isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(Exception.class);
    }

    @Test
    void largeBodySpillsToDisk() {
        String large = "x".repeat(10_000);
        server.enqueue(new MockResponse().setResponseCode(200).setBody(large));
        transport.setMaxResponseBodyMemory(1024);

        Response response = transport.execute(Request.of("GET", server.url("/large").uri()));

        assertThat(transport.maxResponseBodyMemory()).isEqualTo(1024);
        assertThat(transport.newResponseBuffer().threshold()).isEqualTo(1024);
        assertThat(response.body().contentLength()).isEqualTo(10_000);
        assertThat(response.body().getClass().getSimpleName()).isEqualTo("FileBody");
        assertThat(response.body().asString()).isEqualTo(large);
    }

    @Test
    void smallBodyStaysInMemory() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("small"));

        Response response = transport.execute(Request.of("GET", server.url("/small").uri()));

        assertThat(transport.newResponseBuffer().threshold()).isEqualTo(SpillBuffer.DEFAULT_THRESHOLD);
        assertThat(response.body().isRepeatable()).isTrue();
        assertThat(response.body().getClass().getSimpleName()).isEqualTo("ByteArrayBody");
    }

    @Test
    void concurrentCallsOnOneTransportGetTheirOwnResponses() throws Exception {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setResponseCode(200).setBody("echo " + request.getPath());
            }
        });
        int calls = 8;
        ExecutorService pool = Executors.newFixedThreadPool(calls);
        try {
            List<Future<Response>> futures = new ArrayList<>();
            for (int i = 0; i < calls; i++) {
                URI target = server.url("/call/" + i).uri();
                futures.add(pool.submit(() -> transport.execute(Request.of("GET", target))));
            }

            for (int i = 0; i < calls; i++) {
                Response response = futures.get(i).get(30, TimeUnit.SECONDS);
                assertThat(response.status()).isEqualTo(200);
                assertThat(response.body().asString()).isEqualTo("echo /call/" + i);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(server.getRequestCount()).isEqualTo(calls);
    }

    @Test
    void debugTraceGoesToSideChannelOnlyWhenEnabled() {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        NetworkTransport traced = NetworkTransport.builder()
                .debugOutput(new PrintStream(sink, true, StandardCharsets.UTF_8))
                .build();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("quiet"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("loud"));

        traced.execute(Request.of("GET", server.url("/quiet").uri()));
        assertThat(sink.size()).isZero();

        Response response = traced.setDebug(true).execute(Request.of("GET", server.url("/loud").uri())
                .withHeader("X-Trace", "yes"));
        String trace = sink.toString(StandardCharsets.UTF_8);

        assertThat(response.body().asString()).isEqualTo("loud");
        assertThat(trace).contains("* Trying");
        assertThat(trace).contains("> GET /loud");
        assertThat(trace).contains("> X-Trace: yes");
        assertThat(trace).contains("200 OK");
    }
}
