package io.shuttle.core.body;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot body over a caller supplied stream.
 */
public final class InputStreamBody implements Body {

    private final InputStream in;
    private final long contentLength;
    private final String contentType;
    private final AtomicBoolean consumed = new AtomicBoolean();

    public InputStreamBody(InputStream in, long contentLength, String contentType) {
        this.in = Objects.requireNonNull(in, "in");
        this.contentLength = contentLength;
        this.contentType = contentType;
    }

    @Override
    public InputStream stream() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("body stream was already consumed");
        }
        return in;
    }

    @Override
    public long contentLength() {
        return contentLength;
    }

    @Override
    public Optional<String> contentType() {
        return Optional.ofNullable(contentType);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
