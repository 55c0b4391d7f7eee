package io.shuttle.core.body;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * URL encoded form request body. Fields are written in the map's iteration order.
 */
public final class FormBody extends ByteArrayBody {

    public static final String CONTENT_TYPE = "application/x-www-form-urlencoded";

    public FormBody(Map<String, String> fields) {
        super(encode(fields).getBytes(StandardCharsets.UTF_8), CONTENT_TYPE);
    }

    static String encode(Map<String, String> fields) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : fields.entrySet()) {
            if (e.getKey() == null) continue;
            if (sb.length() > 0) sb.append('&');
            sb.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)).append('=');
            if (e.getValue() != null) {
                sb.append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
            }
        }
        return sb.toString();
    }
}
