package uk.gegc.creditledger.features.wallet.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the JSON metadata stored on ledger entries and reservations.
 * Null values are dropped; an empty map is stored as {@code null}.
 */
@Component
@RequiredArgsConstructor
public class LedgerMetadataCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String write(Map<String, ?> metadata) {
        if (metadata == null) {
            return null;
        }
        Map<String, Object> m = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (value != null) {
                m.put(key, value);
            }
        });
        if (m.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable to JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored metadata is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Returns {@code existing} with {@code additions} laid over it, as JSON.
     */
    public String merge(String existing, Map<String, ?> additions) {
        Map<String, Object> merged = read(existing);
        if (additions != null) {
            merged.putAll(additions);
        }
        return write(merged);
    }
}
