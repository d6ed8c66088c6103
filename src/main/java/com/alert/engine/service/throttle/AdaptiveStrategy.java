package com.alert.engine.service.throttle;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.config.AlertEngineConfig;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.ThrottlingStrategyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.random.RandomGenerator;

/**
 * Probabilistic suppression driven by the rule's feedback metrics, falling back to time-window limits.
 * Rules without adaptive learning get the time-window limits only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdaptiveStrategy implements ThrottlingStrategy {

    private final AlertEngineConfig engineConfig;
    private final RandomGenerator random;
    private final TimeBasedStrategy timeBasedStrategy;

    @Override
    public ThrottlingStrategyType type() {
        return ThrottlingStrategyType.ADAPTIVE;
    }

    @Override
    public ThrottlingDecision decide(Alert candidate, AlertDefinition definition, ThrottlingState state, Instant now) {
        if (!definition.getThrottlingConfig().isAdaptiveLearning()) {
            return timeBasedStrategy.decide(candidate, definition, state, now);
        }
        AlertEngineConfig.Adaptive adaptive = engineConfig.getAdaptive();
        AdaptiveMetrics metrics = state.getAdaptiveMetrics();

        if (metrics.getFalsePositiveRate() > adaptive.getFalsePositiveThreshold()
                && random.nextDouble() < adaptive.getFalsePositiveSuppressProbability()) {
            log.debug("Adaptive suppression for {}: false positive rate {}", definition.getId(),
                    metrics.getFalsePositiveRate());
            return ThrottlingDecision.suppress(ThrottlingDecision.Suppress.ADAPTIVE_FALSE_POSITIVES);
        }
        if (metrics.getUserEngagement() < adaptive.getEngagementThreshold()
                && random.nextDouble() < adaptive.getLowEngagementSuppressProbability()) {
            log.debug("Adaptive suppression for {}: user engagement {}", definition.getId(),
                    metrics.getUserEngagement());
            return ThrottlingDecision.suppress(ThrottlingDecision.Suppress.ADAPTIVE_LOW_ENGAGEMENT);
        }
        return timeBasedStrategy.decide(candidate, definition, state, now);
    }
}
