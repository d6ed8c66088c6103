package com.alert.engine.service.throttle;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.ThrottlingStrategyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Cooldown throttling: after an admission, suppress until the cooldown period has passed.
 */
@Slf4j
@Component
public class CountBasedStrategy implements ThrottlingStrategy {

    @Override
    public ThrottlingStrategyType type() {
        return ThrottlingStrategyType.COUNT_BASED;
    }

    @Override
    public ThrottlingDecision decide(Alert candidate, AlertDefinition definition, ThrottlingState state, Instant now) {
        Instant last = state.getLastEventTime();
        Duration cooldown = definition.getThrottlingConfig().getCooldownPeriod();
        if (last != null && Duration.between(last, now).compareTo(cooldown) < 0) {
            log.debug("Cooldown active for {} since {}", definition.getId(), last);
            return ThrottlingDecision.suppress(ThrottlingDecision.Suppress.COOLDOWN_ACTIVE);
        }
        state.recordCooldownAdmission(now);
        return ThrottlingDecision.admit();
    }
}
