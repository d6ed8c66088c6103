package com.alert.engine.service.alert;

import com.alert.engine.service.config.MetricsConfig;
import com.alert.engine.service.definition.AlertType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of AlertStore.
 *
 * Thread-safe using ConcurrentHashMap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryAlertStore implements AlertStore {

    private final MetricsConfig metricsConfig;

    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "alert.store.alerts.count",
                "Number of alerts in memory",
                this::count
        );
        log.info("InMemoryAlertStore initialized");
    }

    @Override
    public void save(Alert alert) {
        if (alerts.putIfAbsent(alert.getId(), alert) != null) {
            throw new AlertProcessingException("Alert id already stored: " + alert.getId(),
                    alert.getId(), AlertProcessingException.PERSISTENCE_FAILED);
        }
        log.debug("Alert stored: {}", alert.getId());
    }

    @Override
    public Optional<Alert> findById(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    @Override
    public Collection<Alert> findAll() {
        return List.copyOf(alerts.values());
    }

    @Override
    public Collection<Alert> findByStatus(AlertStatus status) {
        return alerts.values().stream()
                .filter(alert -> alert.getStatus() == status)
                .toList();
    }

    @Override
    public Optional<Alert> findMostRecentActive(AlertType type) {
        return alerts.values().stream()
                .filter(alert -> alert.getType() == type)
                .filter(alert -> alert.getStatus() == AlertStatus.ACTIVE)
                .max(Comparator.comparing(Alert::getTriggeredAt));
    }

    @Override
    public int count() {
        return alerts.size();
    }
}
