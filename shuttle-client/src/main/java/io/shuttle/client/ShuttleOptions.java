package io.shuttle.client;

import io.shuttle.core.HttpHeaders;
import io.shuttle.core.ProtocolVersion;
import io.shuttle.core.ShuttleException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved client configuration. Read-only once a {@link Shuttle} is built from it.
 *
 * @param handler     innermost stage of the pipeline
 * @param httpVersion protocol version put on every request
 * @param baseUrl     prefix for string targets, or null
 * @param headers     default headers added to every request
 * @param middleware  middleware in execution order
 * @param debug       whether the handler is switched to debug mode at construction
 */
public record ShuttleOptions(
        Transport handler,
        ProtocolVersion httpVersion,
        String baseUrl,
        HttpHeaders headers,
        List<Middleware> middleware,
        boolean debug
) {
    public static final String HANDLER = "handler";
    public static final String HTTP_VERSION = "http_version";
    public static final String BASE_URL = "base_url";
    public static final String HEADERS = "headers";
    public static final String MIDDLEWARE = "middleware";
    public static final String DEBUG = "debug";

    private static final Set<String> KEYS = Set.of(HANDLER, HTTP_VERSION, BASE_URL, HEADERS, MIDDLEWARE, DEBUG);

    public ShuttleOptions {
        if (handler == null) {
            throw new ShuttleException.InvalidConfiguration("handler must be a Transport");
        }
        if (httpVersion == null) {
            httpVersion = ProtocolVersion.HTTP_1_1;
        }
        if (headers == null) {
            headers = HttpHeaders.empty();
        }
        if (middleware == null) {
            middleware = List.of();
        } else {
            for (Middleware m : middleware) {
                if (m == null) {
                    throw new ShuttleException.InvalidConfiguration("middleware must not contain null");
                }
            }
            middleware = List.copyOf(middleware);
        }
    }

    /**
     * Reads options from a loosely typed map, as produced by a configuration file or a script.
     *
     * <p>Recognized keys: {@code handler}, {@code http_version} (String or Number), {@code base_url},
     * {@code headers} (Map), {@code middleware} (List) and {@code debug} (Boolean). Missing keys take
     * their defaults; {@code handler} defaults to a new {@link NetworkTransport}.
     *
     * @throws ShuttleException.InvalidConfiguration   on an unknown key or a wrongly typed value
     * @throws ShuttleException.UnknownProtocolVersion on an unsupported {@code http_version}
     */
    public static ShuttleOptions from(Map<String, ?> options) {
        Objects.requireNonNull(options, "options");
        for (String key : options.keySet()) {
            if (!KEYS.contains(key)) {
                throw new ShuttleException.InvalidConfiguration("Unknown option: " + key);
            }
        }

        Object handler = options.get(HANDLER);
        if (handler != null && !(handler instanceof Transport)) {
            throw new ShuttleException.InvalidConfiguration(
                    "handler must be a Transport, got " + handler.getClass().getName());
        }

        return new ShuttleOptions(
                handler == null ? NetworkTransport.create() : (Transport) handler,
                version(options.get(HTTP_VERSION)),
                typed(options, BASE_URL, String.class),
                headers(options.get(HEADERS)),
                middleware(options.get(MIDDLEWARE)),
                Boolean.TRUE.equals(typed(options, DEBUG, Boolean.class)));
    }

    private static ProtocolVersion version(Object value) {
        if (value == null) {
            return ProtocolVersion.HTTP_1_1;
        }
        if (value instanceof ProtocolVersion) {
            return (ProtocolVersion) value;
        }
        if (value instanceof String) {
            return ProtocolVersion.parse((String) value);
        }
        if (value instanceof Number) {
            return ProtocolVersion.parse(numberToken((Number) value));
        }
        throw new ShuttleException.InvalidConfiguration(
                "http_version must be a String or a Number, got " + value.getClass().getName());
    }

    // 2 and 2.0 both read as "2"; 1.0 must stay "1.0" rather than "1".
    private static String numberToken(Number number) {
        double d = number.doubleValue();
        if (d == Math.rint(d) && d != 1.0) {
            return Long.toString((long) d);
        }
        return number.toString();
    }

    private static HttpHeaders headers(Object value) {
        if (value == null) {
            return HttpHeaders.empty();
        }
        if (!(value instanceof Map)) {
            throw new ShuttleException.InvalidConfiguration(
                    "headers must be a Map, got " + value.getClass().getName());
        }
        HttpHeaders headers = HttpHeaders.empty();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
            if (!(e.getKey() instanceof String) || e.getValue() == null) {
                throw new ShuttleException.InvalidConfiguration("headers must map names to values");
            }
            String name = (String) e.getKey();
            Object v = e.getValue();
            try {
                if (v instanceof List) {
                    List<String> values = new ArrayList<>();
                    for (Object item : (List<?>) v) {
                        values.add(String.valueOf(item));
                    }
                    headers = headers.with(name, values);
                } else {
                    headers = headers.with(name, String.valueOf(v));
                }
            } catch (IllegalArgumentException ex) {
                throw new ShuttleException.InvalidConfiguration("Invalid header " + name + ": " + ex.getMessage());
            }
        }
        return headers;
    }

    private static List<Middleware> middleware(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new ShuttleException.InvalidConfiguration(
                    "middleware must be a List, got " + value.getClass().getName());
        }
        List<Middleware> layers = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof Middleware)) {
                throw new ShuttleException.InvalidConfiguration(
                        "middleware entries must be Middleware, got "
                                + (item == null ? "null" : item.getClass().getName()));
            }
            layers.add((Middleware) item);
        }
        return layers;
    }

    private static <T> T typed(Map<String, ?> options, String key, Class<T> type) {
        Object value = options.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new ShuttleException.InvalidConfiguration(
                    key + " must be a " + type.getSimpleName() + ", got " + value.getClass().getName());
        }
        return type.cast(value);
    }
}
