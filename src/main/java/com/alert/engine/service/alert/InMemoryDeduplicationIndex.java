package com.alert.engine.service.alert;

import com.alert.engine.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of DeduplicationIndex.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryDeduplicationIndex implements DeduplicationIndex {

    private final MetricsConfig metricsConfig;

    private final Map<String, Alert> latestByKey = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "alert.store.dedup.count",
                "Number of entries in the deduplication index",
                this::size
        );
    }

    @Override
    public Optional<Alert> findDuplicate(String definitionId, String fingerprint, Instant since) {
        Alert existing = latestByKey.get(key(definitionId, fingerprint));
        if (existing == null || existing.isResolved() || existing.getTriggeredAt().isBefore(since)) {
            return Optional.empty();
        }
        return Optional.of(existing);
    }

    @Override
    public void register(Alert alert) {
        latestByKey.put(key(alert.getDefinitionId(), alert.getFingerprint()), alert);
    }

    @Override
    public void unregister(Alert alert) {
        latestByKey.remove(key(alert.getDefinitionId(), alert.getFingerprint()), alert);
    }

    @Override
    public int prune(Instant cutoff) {
        List<String> toRemove = new ArrayList<>();
        for (Map.Entry<String, Alert> entry : latestByKey.entrySet()) {
            Alert alert = entry.getValue();
            if (alert.isResolved() || alert.getTriggeredAt().isBefore(cutoff)) {
                toRemove.add(entry.getKey());
            }
        }
        int removed = 0;
        for (String key : toRemove) {
            Alert alert = latestByKey.get(key);
            if (alert != null && (alert.isResolved() || alert.getTriggeredAt().isBefore(cutoff))
                    && latestByKey.remove(key, alert)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Pruned {} deduplication index entries", removed);
        }
        return removed;
    }

    @Override
    public int size() {
        return latestByKey.size();
    }

    private static String key(String definitionId, String fingerprint) {
        return definitionId + ":" + fingerprint;
    }
}
