package com.alert.engine.service.alert;

import com.alert.engine.service.definition.AlertType;

import java.util.Collection;
import java.util.Optional;

/**
 * Persistence for alerts. The engine saves and reads alerts but never deletes them.
 */
public interface AlertStore {

    /**
     * Stores a newly admitted alert.
     *
     * @throws AlertProcessingException if the alert cannot be stored
     */
    void save(Alert alert);

    Optional<Alert> findById(String alertId);

    Collection<Alert> findAll();

    Collection<Alert> findByStatus(AlertStatus status);

    /**
     * Most recently triggered ACTIVE alert of the given event type.
     */
    Optional<Alert> findMostRecentActive(AlertType type);

    int count();
}
