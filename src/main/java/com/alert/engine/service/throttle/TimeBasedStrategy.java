package com.alert.engine.service.throttle;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.ThrottlingConfig;
import com.alert.engine.service.definition.ThrottlingStrategyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Admits at most {@code maxAlertsInWindow} alerts per fixed time window.
 */
@Slf4j
@Component
public class TimeBasedStrategy implements ThrottlingStrategy {

    @Override
    public ThrottlingStrategyType type() {
        return ThrottlingStrategyType.TIME_BASED;
    }

    @Override
    public ThrottlingDecision decide(Alert candidate, AlertDefinition definition, ThrottlingState state, Instant now) {
        ThrottlingConfig config = definition.getThrottlingConfig();
        state.resetWindowIfElapsed(now, config.getTimeWindow());

        if (state.getCountInWindow() >= config.getMaxAlertsInWindow()) {
            log.debug("Window limit reached for {}: {}/{}", definition.getId(),
                    state.getCountInWindow(), config.getMaxAlertsInWindow());
            return ThrottlingDecision.suppress(ThrottlingDecision.Suppress.TIME_WINDOW_LIMIT);
        }
        state.recordWindowAdmission(now);
        return ThrottlingDecision.admit();
    }
}
