package io.shuttle.core.body;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Request body serialized to JSON with Jackson, declared as {@code application/json}.
 */
public final class JsonBody extends ByteArrayBody {

    public static final String CONTENT_TYPE = "application/json";

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

    public JsonBody(Object value) {
        this(value, DEFAULT_MAPPER);
    }

    /**
     * @param value  the value to serialize
     * @param mapper the ObjectMapper to serialize with
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public JsonBody(Object value, ObjectMapper mapper) {
        super(serialize(value, mapper), CONTENT_TYPE);
    }

    private static byte[] serialize(Object value, ObjectMapper mapper) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize JSON body", e);
        }
    }
}
