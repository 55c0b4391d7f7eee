package io.shuttle.core.body;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Repeatable body held in memory.
 */
public class ByteArrayBody implements Body {

    static final ByteArrayBody EMPTY = new ByteArrayBody(new byte[0], null);

    private final byte[] bytes;
    private final String contentType;

    public ByteArrayBody(byte[] bytes, String contentType) {
        this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
        this.contentType = contentType;
    }

    @Override
    public InputStream stream() {
        return new ByteArrayInputStream(bytes);
    }

    @Override
    public long contentLength() {
        return bytes.length;
    }

    @Override
    public Optional<String> contentType() {
        return Optional.ofNullable(contentType);
    }

    @Override
    public boolean isRepeatable() {
        return true;
    }

    @Override
    public byte[] readAllBytes() {
        return bytes.clone();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + bytes.length + " bytes"
                + (contentType == null ? "" : ", " + contentType) + "]";
    }
}
