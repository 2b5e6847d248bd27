package io.chrono4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Handler base class for JSON payloads.
 *
 * <p>The payload is decoded into {@link #dataClass()} with Jackson before {@link #handle} is called. An empty
 * payload is passed as {@code null}. A {@link String} result is returned as is, any other non-null result
 * is encoded back to JSON.
 *
 * @param <T> payload type
 */
public abstract class JsonJobHandler<T> implements NamedJobHandler {

    private final ObjectMapper objectMapper;

    protected JsonJobHandler() {
        this(new ObjectMapper());
    }

    protected JsonJobHandler(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public abstract Class<T> dataClass();

    protected abstract Object handle(JobContext context, T data) throws Exception;

    @Override
    public final String execute(JobContext context, String payload) throws Exception {
        T data = decode(payload);
        Object result = handle(context, data);
        if (result == null) {
            return "";
        }
        if (result instanceof String s) {
            return s;
        }
        return objectMapper.writeValueAsString(result);
    }

    private T decode(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(payload, dataClass());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to decode payload for handler " + name() + " as " + dataClass().getSimpleName(), e);
        }
    }
}
