package com.alert.engine.service.fingerprint;

import com.alert.engine.service.alert.AlertProcessingException;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.support.TestDefinitions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FingerprintGeneratorTest {

    private final FingerprintGenerator generator = new FingerprintGenerator(new ObjectMapper());
    private final AlertDefinition definition = TestDefinitions.outOfStock("oos").build();

    @Test
    void fingerprint_isSixteenLowercaseHexCharacters() {
        String fingerprint = generator.fingerprint(definition, Map.of("productId", "p1", "storeId", "s1"));

        assertThat(fingerprint).hasSize(16).matches("[0-9a-f]{16}");
    }

    @Test
    void fingerprint_ignoresKeyOrderAndFieldsOutsideProjection() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("productId", "p1");
        first.put("storeId", "s1");
        first.put("quantity", 0);

        Map<String, Object> second = new LinkedHashMap<>();
        second.put("quantity", 7);
        second.put("storeId", "s1");
        second.put("productId", "p1");
        second.put("productName", "Widget");

        assertThat(generator.fingerprint(definition, first)).isEqualTo(generator.fingerprint(definition, second));
    }

    @Test
    void fingerprint_omitsNullFields() {
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("productId", "p1");
        withNull.put("storeId", null);

        assertThat(generator.fingerprint(definition, withNull))
                .isEqualTo(generator.fingerprint(definition, Map.of("productId", "p1")));
    }

    @Test
    void fingerprint_differsForDifferentProjection() {
        assertThat(generator.fingerprint(definition, Map.of("productId", "p1", "storeId", "s1")))
                .isNotEqualTo(generator.fingerprint(definition, Map.of("productId", "p2", "storeId", "s1")));
    }

    @Test
    void fingerprint_unserializableValue_raisesProcessingError() {
        Map<String, Object> data = Map.of("productId", new Object(), "storeId", "s1");

        assertThatThrownBy(() -> generator.fingerprint(definition, data))
                .isInstanceOf(AlertProcessingException.class)
                .extracting("errorCode")
                .isEqualTo(AlertProcessingException.FINGERPRINT_FAILED);
    }
}
