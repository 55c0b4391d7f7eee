package io.shuttle.core.body;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * {@code multipart/form-data} request body assembled from {@link Part}s.
 */
public final class MultipartFormBody extends ByteArrayBody {

    private static final String CRLF = "\r\n";

    private final String boundary;

    public MultipartFormBody(List<Part> parts) {
        this(parts, "----ShuttleBoundary" + UUID.randomUUID().toString().replace("-", ""));
    }

    public MultipartFormBody(List<Part> parts, String boundary) {
        super(encode(parts, boundary), "multipart/form-data; boundary=" + boundary);
        this.boundary = boundary;
    }

    public String boundary() {
        return boundary;
    }

    private static byte[] encode(List<Part> parts, String boundary) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("multipart body needs at least one part");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Part part : parts) {
            StringBuilder head = new StringBuilder();
            head.append("--").append(boundary).append(CRLF);
            head.append("Content-Disposition: form-data; name=\"").append(quote(part.name())).append('"');
            if (part.isFile()) {
                head.append("; filename=\"").append(quote(part.filename())).append('"');
            }
            head.append(CRLF);
            if (part.contentType() != null) {
                head.append("Content-Type: ").append(part.contentType()).append(CRLF);
            }
            head.append(CRLF);
            out.writeBytes(head.toString().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(part.content());
            out.writeBytes(CRLF.getBytes(StandardCharsets.US_ASCII));
        }
        out.writeBytes(("--" + boundary + "--" + CRLF).getBytes(StandardCharsets.US_ASCII));
        return out.toByteArray();
    }

    private static String quote(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
