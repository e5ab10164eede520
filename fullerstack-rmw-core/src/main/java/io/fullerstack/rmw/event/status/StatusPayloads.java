package io.fullerstack.rmw.event.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * JSON codec for the opaque {@code data} field of {@link io.fullerstack.rmw.event.EventStatus}.
 * <p>
 * Producers encode a payload record when they raise the event; readers decode it when they
 * build the typed status view. Unknown properties are ignored so older readers keep working
 * when a payload gains fields.
 */
public final class StatusPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private StatusPayloads() {
    }

    public static String encode(Object payload) {
        Objects.requireNonNull(payload, "payload cannot be null");
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StatusPayloadException("Failed to encode " + payload.getClass().getSimpleName(), e);
        }
    }

    /**
     * @return the decoded payload, or {@code null} if {@code data} is null or blank
     */
    public static <T> T decode(String data, Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        if (data == null || data.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(data, type);
        } catch (JsonProcessingException e) {
            throw new StatusPayloadException("Failed to decode " + type.getSimpleName() + " from: " + data, e);
        }
    }
}
