package io.shuttle.core.body;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Message body: an opaque byte source with an optional declared content type.
 *
 * <p>A body is read through {@link #stream()}. Unless {@link #isRepeatable()} is true the stream may
 * only be obtained once; a second call fails with {@link IllegalStateException}.
 *
 * <p>Example usage:
 * <pre>{@code
 * Response response = shuttle.post("/books", new JsonBody(Map.of("title", "Dune")));
 * String text = response.body().asString();
 * }</pre>
 */
public interface Body extends Closeable {

    /**
     * Opens the body for reading. The caller closes the returned stream.
     *
     * @throws IllegalStateException if the body is not repeatable and was already read
     */
    InputStream stream() throws IOException;

    /**
     * @return the body size in bytes, or -1 if unknown
     */
    long contentLength();

    /**
     * @return the media type this body declares, used for the request {@code Content-Type}
     */
    default Optional<String> contentType() {
        return Optional.empty();
    }

    /**
     * @return true if {@link #stream()} may be called more than once
     */
    default boolean isRepeatable() {
        return false;
    }

    /**
     * Reads the whole body into memory.
     */
    default byte[] readAllBytes() {
        try (InputStream in = stream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read body", e);
        }
    }

    /**
     * Reads the whole body as UTF-8 text.
     */
    default String asString() {
        return new String(readAllBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Releases resources held by the body, such as a temporary file. No-op by default.
     */
    @Override
    default void close() throws IOException {
    }

    static Body empty() {
        return ByteArrayBody.EMPTY;
    }

    static Body of(String text) {
        Objects.requireNonNull(text, "text");
        return new ByteArrayBody(text.getBytes(StandardCharsets.UTF_8), null);
    }

    static Body of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new ByteArrayBody(bytes, null);
    }

    /**
     * Wraps a stream that can be read exactly once.
     */
    static Body of(InputStream in) {
        return new InputStreamBody(in, -1, null);
    }
}
