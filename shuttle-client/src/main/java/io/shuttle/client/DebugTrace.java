package io.shuttle.client;

import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpRequest;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.ProtocolVersion;
import org.apache.hc.core5.http.protocol.HttpContext;

import java.io.PrintStream;

/**
 * Verbose exchange trace written to a side channel, in the familiar {@code *}, {@code >} and
 * {@code <} line prefixes. Every redirect hop is traced.
 */
final class DebugTrace {

    private static final DebugTrace DISABLED = new DebugTrace(null);

    private final PrintStream out;

    private DebugTrace(PrintStream out) {
        this.out = out;
    }

    static DebugTrace to(PrintStream out) {
        return new DebugTrace(out);
    }

    static DebugTrace disabled() {
        return DISABLED;
    }

    boolean enabled() {
        return out != null;
    }

    void info(String message) {
        if (out == null) return;
        out.println("* " + message);
    }

    void requestHead(HttpRequest request, HttpContext context) {
        if (out == null) return;
        ProtocolVersion version = request.getVersion() != null ? request.getVersion() : context.getProtocolVersion();
        StringBuilder sb = new StringBuilder();
        sb.append("> ").append(request.getMethod()).append(' ').append(request.getRequestUri());
        if (version != null) sb.append(' ').append(version);
        sb.append(System.lineSeparator());
        appendHeaders(sb, "> ", request.getHeaders());
        sb.append('>');
        out.println(sb);
    }

    void responseHead(HttpResponse response, HttpContext context) {
        if (out == null) return;
        ProtocolVersion version = response.getVersion() != null ? response.getVersion() : context.getProtocolVersion();
        StringBuilder sb = new StringBuilder("< ");
        if (version != null) sb.append(version).append(' ');
        sb.append(response.getCode());
        if (response.getReasonPhrase() != null && !response.getReasonPhrase().isEmpty()) {
            sb.append(' ').append(response.getReasonPhrase());
        }
        sb.append(System.lineSeparator());
        appendHeaders(sb, "< ", response.getHeaders());
        sb.append('<');
        out.println(sb);
    }

    private static void appendHeaders(StringBuilder sb, String prefix, Header[] headers) {
        for (Header h : headers) {
            sb.append(prefix).append(h.getName()).append(": ").append(h.getValue()).append(System.lineSeparator());
        }
    }
}
