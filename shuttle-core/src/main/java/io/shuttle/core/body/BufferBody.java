package io.shuttle.core.body;

import java.nio.charset.StandardCharsets;

/**
 * Plain text request body, declared as {@code text/plain}.
 */
public final class BufferBody extends ByteArrayBody {

    public static final String CONTENT_TYPE = "text/plain";

    public BufferBody(String text) {
        this(text, CONTENT_TYPE);
    }

    public BufferBody(String text, String contentType) {
        super(text.getBytes(StandardCharsets.UTF_8), contentType);
    }
}
