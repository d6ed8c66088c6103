package com.alert.engine.service.throttle;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AlertLifecycleManager;
import com.alert.engine.service.alert.AlertStore;
import com.alert.engine.service.alert.IllegalAlertTransitionException;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.ThrottlingConfig;
import com.alert.engine.service.definition.ThrottlingStrategyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Once a rule has escalated often enough within the window, further events escalate the most
 * recent active alert of the same type instead of creating new ones.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EscalationBasedStrategy implements ThrottlingStrategy {

    static final String AUTOMATIC_ESCALATION_REASON = "automatic_escalation_due_to_throttling";

    private final AlertStore alertStore;
    private final AlertLifecycleManager lifecycleManager;

    @Override
    public ThrottlingStrategyType type() {
        return ThrottlingStrategyType.ESCALATION_BASED;
    }

    @Override
    public ThrottlingDecision decide(Alert candidate, AlertDefinition definition, ThrottlingState state, Instant now) {
        ThrottlingConfig config = definition.getThrottlingConfig();
        Instant lastEscalation = state.getLastEscalationTime();
        boolean thresholdReached = state.getEscalationCount() >= config.getEscalationThreshold();
        boolean recent = lastEscalation != null && !lastEscalation.isBefore(now.minus(config.getTimeWindow()));
        if (!thresholdReached || !recent) {
            return ThrottlingDecision.admit();
        }

        Optional<Alert> existing = alertStore.findMostRecentActive(definition.getEventType());
        if (existing.isEmpty()) {
            log.debug("Escalation threshold reached for {} but no active alert to escalate", definition.getId());
            return ThrottlingDecision.admit();
        }
        Alert target = existing.get();
        try {
            lifecycleManager.escalate(target, definition, AUTOMATIC_ESCALATION_REASON, "system");
        } catch (IllegalAlertTransitionException e) {
            log.debug("Alert {} left the active state before escalation: {}", target.getId(), e.getMessage());
            return ThrottlingDecision.admit();
        }
        log.info("Escalated existing alert {} instead of admitting new {} alert", target.getId(),
                definition.getEventType().getValue());
        return ThrottlingDecision.suppress(ThrottlingDecision.Suppress.ESCALATED_EXISTING);
    }
}
