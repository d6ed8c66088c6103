package com.alert.engine.service.throttle;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AlertProcessingException;
import com.alert.engine.service.alert.DeduplicationIndex;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.DeduplicationSettings;
import com.alert.engine.service.definition.ThrottlingStrategyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a candidate alert is admitted, suppressed or merged into a live duplicate.
 *
 * Deduplication runs first and wins over every strategy. Callers must hold the state's lock.
 */
@Slf4j
@Component
public class ThrottlingEngine {

    private final DeduplicationIndex deduplicationIndex;
    private final Map<ThrottlingStrategyType, ThrottlingStrategy> strategies = new EnumMap<>(ThrottlingStrategyType.class);

    public ThrottlingEngine(DeduplicationIndex deduplicationIndex, List<ThrottlingStrategy> strategies) {
        this.deduplicationIndex = deduplicationIndex;
        for (ThrottlingStrategy strategy : strategies) {
            this.strategies.put(strategy.type(), strategy);
        }
        log.info("Throttling engine initialized with strategies: {}", this.strategies.keySet());
    }

    public ThrottlingDecision decide(Alert candidate, AlertDefinition definition, ThrottlingState state, Instant now) {
        try {
            state.touch(now);

            Optional<Alert> duplicate = findDuplicate(candidate, definition, now);
            if (duplicate.isPresent()) {
                return ThrottlingDecision.deduplicate(duplicate.get().getId());
            }
            return applyStrategy(candidate, definition, state, now);
        } catch (AlertProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw throttlingFailed(definition, e);
        }
    }

    /**
     * Runs only the definition's strategy, skipping the duplicate lookup.
     * Used when a matched duplicate is no longer live.
     */
    public ThrottlingDecision decideWithoutDeduplication(Alert candidate, AlertDefinition definition,
                                                         ThrottlingState state, Instant now) {
        try {
            state.touch(now);
            return applyStrategy(candidate, definition, state, now);
        } catch (AlertProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw throttlingFailed(definition, e);
        }
    }

    // --- Private helpers ---

    private ThrottlingDecision applyStrategy(Alert candidate, AlertDefinition definition, ThrottlingState state,
                                             Instant now) {
        ThrottlingStrategy strategy = strategies.get(definition.getThrottlingStrategy());
        if (strategy == null) {
            throw new AlertProcessingException(
                    "No throttling strategy registered for " + definition.getThrottlingStrategy(),
                    definition.getId(), AlertProcessingException.THROTTLING_FAILED);
        }
        ThrottlingDecision decision = strategy.decide(candidate, definition, state, now);
        log.debug("Throttling decision for {} [{}]: {}", definition.getId(), strategy.type(), decision);
        return decision;
    }

    private static AlertProcessingException throttlingFailed(AlertDefinition definition, RuntimeException cause) {
        return new AlertProcessingException("Throttling failed for definition " + definition.getId(),
                definition.getId(), AlertProcessingException.THROTTLING_FAILED, cause);
    }

    private Optional<Alert> findDuplicate(Alert candidate, AlertDefinition definition, Instant now) {
        DeduplicationSettings settings = definition.getDeduplication();
        if (settings == null || !settings.isEnabled()) {
            return Optional.empty();
        }
        return deduplicationIndex.findDuplicate(definition.getId(), candidate.getFingerprint(),
                now.minus(settings.getWindow()));
    }
}
