package io.shuttle.core.body;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Write-side store for a response body with bounded memory use.
 *
 * <p>Bytes are kept in memory until the total size passes {@code threshold}; from then on the content
 * lives in a temporary file. {@link #toBody(String)} hands the content over as a repeatable
 * {@link Body}; {@link #discard()} drops it.
 *
 * <p>Not thread-safe: one buffer belongs to one exchange.
 */
public final class SpillBuffer {

    private static final Logger log = LoggerFactory.getLogger(SpillBuffer.class);

    /** Default in-memory limit: 2 MiB. */
    public static final long DEFAULT_THRESHOLD = 2L * 1024 * 1024;

    private final long threshold;
    private ByteArrayOutputStream memory = new ByteArrayOutputStream();
    private Path file;
    private FileChannel channel;
    private long size;
    private boolean sealed;

    public SpillBuffer() {
        this(DEFAULT_THRESHOLD);
    }

    public SpillBuffer(long threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        this.threshold = threshold;
    }

    public long threshold() {
        return threshold;
    }

    public long size() {
        return size;
    }

    /**
     * @return true once the content has moved to a temporary file
     */
    public boolean isSpilled() {
        return file != null;
    }

    Path file() {
        return file;
    }

    public void write(byte[] bytes) throws IOException {
        write(ByteBuffer.wrap(bytes));
    }

    /**
     * Appends the remaining bytes of {@code src}.
     */
    public void write(ByteBuffer src) throws IOException {
        if (sealed) {
            throw new IllegalStateException("buffer was already handed over or discarded");
        }
        int n = src.remaining();
        if (n == 0) return;

        if (file == null && size + n > threshold) {
            spill();
        }
        if (file == null) {
            byte[] chunk = new byte[n];
            src.get(chunk);
            memory.writeBytes(chunk);
        } else {
            while (src.hasRemaining()) {
                channel.write(src);
            }
        }
        size += n;
    }

    /**
     * Seals the buffer and returns its content as a repeatable body.
     */
    public Body toBody(String contentType) throws IOException {
        if (sealed) {
            throw new IllegalStateException("buffer was already handed over or discarded");
        }
        sealed = true;
        if (file == null) {
            byte[] bytes = memory.toByteArray();
            memory = null;
            return new ByteArrayBody(bytes, contentType);
        }
        channel.close();
        return new FileBody(file, size, contentType);
    }

    /**
     * Drops the content and deletes the temporary file, if any. Safe to call more than once.
     */
    public void discard() {
        sealed = true;
        memory = null;
        if (file == null) return;
        try {
            if (channel.isOpen()) channel.close();
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete response spill file {}", file, e);
        }
    }

    private void spill() throws IOException {
        file = Files.createTempFile("shuttle-body-", ".tmp");
        channel = FileChannel.open(file, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        byte[] buffered = memory.toByteArray();
        ByteBuffer head = ByteBuffer.wrap(buffered);
        while (head.hasRemaining()) {
            channel.write(head);
        }
        memory = null;
        log.debug("Response body passed {} bytes, spilled to {}", threshold, file);
    }

    /**
     * Body backed by a spill file. Closing it deletes the file.
     */
    static final class FileBody implements Body {
        private final Path file;
        private final long length;
        private final String contentType;

        FileBody(Path file, long length, String contentType) {
            this.file = file;
            this.length = length;
            this.contentType = contentType;
        }

        @Override
        public InputStream stream() throws IOException {
            if (!Files.exists(file)) {
                throw new IllegalStateException("body was closed");
            }
            return Files.newInputStream(file);
        }

        @Override
        public long contentLength() {
            return length;
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
        public void close() throws IOException {
            Files.deleteIfExists(file);
        }

        Path file() {
            return file;
        }
    }
}
