package com.alert.engine.service.alert;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * System state registry fed through {@link #record}, keyed by definition and fingerprint.
 *
 * Later snapshots are merged over earlier ones. Null values are dropped.
 */
@Slf4j
@Component
public class InMemorySystemStateProvider implements SystemStateProvider {

    private final Map<String, Map<String, Object>> states = new ConcurrentHashMap<>();

    public void record(String definitionId, String fingerprint, Map<String, Object> state) {
        states.compute(key(definitionId, fingerprint), (key, previous) -> {
            Map<String, Object> merged = previous == null ? new HashMap<>() : new HashMap<>(previous);
            state.forEach((field, value) -> {
                if (value != null) {
                    merged.put(field, value);
                }
            });
            return Map.copyOf(merged);
        });
        log.debug("System state recorded: definition={}, fingerprint={}", definitionId, fingerprint);
    }

    @Override
    public Map<String, Object> currentState(Alert alert) {
        return states.getOrDefault(key(alert.getDefinitionId(), alert.getFingerprint()), Map.of());
    }

    private static String key(String definitionId, String fingerprint) {
        return definitionId + ":" + fingerprint;
    }
}
