package com.alert.engine.service.alert;

import java.time.Instant;
import java.util.Optional;

/**
 * Index of the latest live alert per (definition, fingerprint).
 */
public interface DeduplicationIndex {

    /**
     * Finds a non-resolved alert with the same definition and fingerprint triggered at or after {@code since}.
     */
    Optional<Alert> findDuplicate(String definitionId, String fingerprint, Instant since);

    void register(Alert alert);

    /**
     * Removes the entry only if it still points at this alert.
     */
    void unregister(Alert alert);

    /**
     * Drops entries for resolved alerts and alerts triggered before the cutoff.
     *
     * @return number of entries removed
     */
    int prune(Instant cutoff);

    int size();
}
