package io.shuttle.client;

import io.shuttle.core.HttpHeaders;
import io.shuttle.core.ProtocolVersion;
import io.shuttle.core.Response;
import io.shuttle.core.body.Body;
import io.shuttle.core.body.SpillBuffer;
import org.apache.hc.client5.http.async.methods.AbstractBinResponseConsumer;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.protocol.HttpContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;

/**
 * Builds a {@link Response} from engine callbacks: the head callback fills status, reason phrase,
 * version and headers, the data callback streams body bytes into a {@link SpillBuffer}.
 *
 * <p>The buffer is discarded unless a response was handed over, so a failed exchange never leaves a
 * partial body behind.
 */
final class ResponseAssembler extends AbstractBinResponseConsumer<Response> {

    private final SpillBuffer buffer;
    private final ProtocolVersion requestedVersion;

    private int status;
    private String reasonPhrase;
    private ProtocolVersion version;
    private HttpHeaders headers = HttpHeaders.empty();
    private volatile boolean handedOver;

    ResponseAssembler(SpillBuffer buffer, ProtocolVersion requestedVersion) {
        this.buffer = buffer;
        this.requestedVersion = requestedVersion;
    }

    @Override
    protected void start(HttpResponse response, ContentType contentType) {
        status = response.getCode();
        // HTTP/2 carries no reason phrase; Response falls back to the registry.
        reasonPhrase = response.getReasonPhrase();
        org.apache.hc.core5.http.ProtocolVersion wire = response.getVersion();
        version = wire == null ? requestedVersion : ProtocolVersion.of(wire.getMajor(), wire.getMinor());

        HttpHeaders parsed = HttpHeaders.empty();
        for (Header header : response.getHeaders()) {
            parsed = parsed.withAdded(header.getName(), header.getValue());
        }
        headers = parsed;
    }

    @Override
    protected int capacityIncrement() {
        return Integer.MAX_VALUE;
    }

    @Override
    protected void data(ByteBuffer src, boolean endOfStream) throws IOException {
        buffer.write(src);
    }

    @Override
    protected Response buildResult() {
        try {
            Body body = buffer.toBody(headers.firstValue("Content-Type").orElse(null));
            handedOver = true;
            return Response.of(status, reasonPhrase, version, headers, body);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to finish response body", e);
        }
    }

    @Override
    public void informationResponse(HttpResponse response, HttpContext context) {
        // 1xx interim responses are not part of the result
    }

    @Override
    public void failed(Exception cause) {
        buffer.discard();
    }

    @Override
    public void releaseResources() {
        if (!handedOver) {
            buffer.discard();
        }
    }
}
