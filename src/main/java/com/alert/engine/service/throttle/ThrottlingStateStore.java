package com.alert.engine.service.throttle;

import com.alert.engine.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Per-definition throttling state, created lazily and removed only by idle pruning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThrottlingStateStore {

    private final MetricsConfig metricsConfig;

    private final Map<String, ThrottlingState> states = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "alert.store.throttling.count",
                "Number of active throttling states",
                this::size
        );
    }

    public ThrottlingState getOrCreate(String definitionId, Instant now) {
        return states.computeIfAbsent(definitionId, id -> {
            log.debug("Creating throttling state for definition: {}", id);
            return new ThrottlingState(id, now);
        });
    }

    /**
     * Runs the action on the definition's live state while holding its lock, touching it first.
     * A state retired by pruning while the caller waited for the lock is replaced by a fresh one.
     */
    public <T> T computeLocked(String definitionId, Instant now, Function<ThrottlingState, T> action) {
        while (true) {
            ThrottlingState state = getOrCreate(definitionId, now);
            state.lock().lock();
            try {
                if (!state.isRetired()) {
                    state.touch(now);
                    return action.apply(state);
                }
            } finally {
                state.lock().unlock();
            }
            log.debug("Throttling state for {} was pruned while waiting, retrying", definitionId);
        }
    }

    public Optional<ThrottlingState> find(String definitionId) {
        return Optional.ofNullable(states.get(definitionId));
    }

    /**
     * Counts an escalation against the definition's state.
     */
    public void recordEscalation(String definitionId, Instant now) {
        computeLocked(definitionId, now, state -> {
            state.recordEscalation(now);
            return state;
        });
    }

    public void recordResolution(String definitionId, boolean falsePositive, Duration timeToResolve) {
        find(definitionId).ifPresent(state -> state.withLock(() ->
                state.getAdaptiveMetrics().recordResolution(falsePositive, timeToResolve)));
    }

    public void recordEngagement(String definitionId) {
        find(definitionId).ifPresent(state ->
                state.withLock(() -> state.getAdaptiveMetrics().recordEngagement()));
    }

    /**
     * Applies one decay step to the adaptive metrics of every state.
     */
    public void decayAdaptiveMetrics(double step) {
        for (String definitionId : new ArrayList<>(states.keySet())) {
            find(definitionId).ifPresent(state ->
                    state.withLock(() -> state.getAdaptiveMetrics().decay(step)));
        }
    }

    /**
     * Removes states with no activity since the cutoff.
     *
     * @return number of states removed
     */
    public int pruneIdle(Instant cutoff) {
        List<String> toRemove = new ArrayList<>();
        for (Map.Entry<String, ThrottlingState> entry : states.entrySet()) {
            if (entry.getValue().isIdleSince(cutoff)) {
                toRemove.add(entry.getKey());
            }
        }
        int removed = 0;
        for (String definitionId : toRemove) {
            ThrottlingState state = states.get(definitionId);
            if (state != null && retireIfIdle(state, cutoff)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Pruned {} idle throttling states", removed);
        }
        return removed;
    }

        public int size() {
        return states.size();
    }

    private boolean retireIfIdle(ThrottlingState state, Instant cutoff) {
        return state.computeLocked(() -> {
            if (state.isRetired() || !state.isIdleSince(cutoff)
                    || !states.remove(state.getDefinitionId(), state)) {
                return false;
            }
            state.retire();
            return true;
        });
    }
}
