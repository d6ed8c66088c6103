package com.alert.engine.service.fingerprint;

import com.alert.engine.service.alert.AlertProcessingException;
import com.alert.engine.service.definition.AlertDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the deduplication key of an event.
 *
 * The event is projected onto the definition's deduplication fields, sorted by field name,
 * serialized as JSON and hashed with SHA-256. The key is the first 16 hex characters.
 */
@Component
@RequiredArgsConstructor
public class FingerprintGenerator {

    static final int FINGERPRINT_LENGTH = 16;

    private final ObjectMapper objectMapper;

    public String fingerprint(AlertDefinition definition, Map<String, Object> eventData) {
        Map<String, Object> projection = new TreeMap<>();
        for (String field : definition.getDeduplication().getFields()) {
            Object value = eventData.get(field);
            if (value != null) {
                projection.put(field, value);
            }
        }
        try {
            byte[] json = objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsBytes(projection);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest).substring(0, FINGERPRINT_LENGTH);
        } catch (JsonProcessingException e) {
            throw new AlertProcessingException(
                    "Failed to serialize fingerprint fields for definition " + definition.getId(),
                    definition.getId(), AlertProcessingException.FINGERPRINT_FAILED, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
