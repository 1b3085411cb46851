package me.christianrobert.policyguard.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts {@code Json} and typed field values between Java structures and their jsonb text form.
 *
 * <p>Writes: maps, lists and scalars are serialized; strings are passed through as already-serialized JSON.
 * Reads: {@code json}/{@code jsonb} driver objects are parsed into maps, lists and scalars.
 */
public class JsonValueCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonValueCodec.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public String toJson(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses json columns of a result row; other values are returned unchanged.
     */
    public Map<String, Object> decodeRow(Map<String, Object> row) {
        Map<String, Object> decoded = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            decoded.put(entry.getKey(), decodeValue(entry.getValue()));
        }
        return decoded;
    }

    Object decodeValue(Object value) {
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                items.add(decodeValue(item));
            }
            return items;
        }
        if (!(value instanceof PGobject)) {
            return value;
        }
        PGobject object = (PGobject) value;
        if (!"json".equals(object.getType()) && !"jsonb".equals(object.getType())) {
            return object.getValue();
        }
        if (object.getValue() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(object.getValue(), Object.class);
        } catch (JsonProcessingException e) {
            log.warn("Returning unparsable {} value as text: {}", object.getType(), e.getOriginalMessage());
            return object.getValue();
        }
    }
}
