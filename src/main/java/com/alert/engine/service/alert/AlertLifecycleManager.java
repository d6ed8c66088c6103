package com.alert.engine.service.alert;

import com.alert.engine.service.config.AlertEngineConfig;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.AlertDefinitionRegistry;
import com.alert.engine.service.definition.AlertPriority;
import com.alert.engine.service.definition.AutoResolvePolicy;
import com.alert.engine.service.evaluate.ConditionEvaluator;
import com.alert.engine.service.metrics.MetricsCollector;
import com.alert.engine.service.notify.NotificationService;
import com.alert.engine.service.throttle.ThrottlingStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every alert status transition: admission, duplicate merges, escalation, operator actions
 * and auto-resolution. Each transition appends to the alert's audit trail.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertLifecycleManager {

    public static final String SYSTEM_ACTOR = "system";
    public static final String FALSE_POSITIVE = "false_positive";
    public static final String AUTO_RESOLVED_TIMEOUT = "auto_resolved_timeout";
    public static final String AUTO_RESOLVED_CONDITIONS = "auto_resolved_conditions_met";
    static final String IMMEDIATE_ESCALATION_REASON = "immediate_escalation_high_severity";

    private final AlertStore alertStore;
    private final DeduplicationIndex deduplicationIndex;
    private final ThrottlingStateStore stateStore;
    private final NotificationService notificationService;
    private final MetricsCollector metricsCollector;
    private final AlertDefinitionRegistry definitionRegistry;
    private final ConditionEvaluator conditionEvaluator;
    private final SystemStateProvider systemStateProvider;
    private final AlertEngineConfig engineConfig;
    private final Clock clock;

    // ==================== Pipeline Transitions ====================

    /**
     * Commits a candidate as a new ACTIVE alert.
     *
     * @throws AlertProcessingException with {@code PERSISTENCE_FAILED} if the store rejects it
     */
    public Alert admit(Alert candidate) {
        deduplicationIndex.register(candidate);
        try {
            alertStore.save(candidate);
        } catch (RuntimeException e) {
            deduplicationIndex.unregister(candidate);
            log.error("Failed to store alert {} for definition {}", candidate.getId(), candidate.getDefinitionId(), e);
            if (e instanceof AlertProcessingException processing) {
                throw processing;
            }
            throw new AlertProcessingException("Failed to store alert " + candidate.getId(),
                    candidate.getDefinitionId(), AlertProcessingException.PERSISTENCE_FAILED, e);
        }
        candidate.appendAudit(new AuditEntry(clock.instant(), AuditEntry.ALERT_ADMITTED, SYSTEM_ACTOR, Map.of(
                "definitionId", candidate.getDefinitionId(),
                "fingerprint", candidate.getFingerprint())));
        log.info("Alert admitted: {} [{}] {}", candidate.getId(), candidate.getPriority(), candidate.getTitle());
        return candidate;
    }

    /**
     * Folds a duplicate candidate into the live alert it matched.
     */
    public Alert mergeDuplicate(String existingAlertId, Alert candidate) {
        Alert existing = require(existingAlertId);
        existing.mergeDuplicate(candidate.getId(), candidate.getDetails(), clock.instant());
        log.debug("Alert {} deduplicated into {} (count {})", candidate.getId(), existingAlertId,
                existing.getOriginalCount());
        return existing;
    }

    public EscalationRecord escalate(Alert alert, AlertDefinition definition, String reason, String actor) {
        Instant now = clock.instant();
        List<String> recipients = definition.getEscalationRecipients();
        EscalationRecord record = alert.escalate(recipients, reason, actor, now);
        stateStore.recordEscalation(definition.getId(), now);
        metricsCollector.recordEscalated();
        notificationService.dispatchEscalation(alert, definition, recipients);
        log.info("Alert {} escalated to level {} ({}) by {}", alert.getId(), record.level(), reason, actor);
        return record;
    }

    /**
     * Escalates right after admission when the alert is severe enough.
     *
     * @return whether the alert was escalated
     */
    public boolean checkImmediateEscalation(Alert alert, AlertDefinition definition) {
        if (!engineConfig.getFeatures().isImmediateEscalationEnabled()) {
            return false;
        }
        boolean severe = alert.getSeverity() >= engineConfig.getEscalation().getImmediateSeverity()
                || alert.getPriority() == AlertPriority.EMERGENCY;
        if (!severe) {
            return false;
        }
        escalate(alert, definition, IMMEDIATE_ESCALATION_REASON, SYSTEM_ACTOR);
        return true;
    }

    // ==================== Operator Actions ====================

    public Alert escalate(String alertId, String reason, String actor) {
        Alert alert = require(alertId);
        escalate(alert, definitionOf(alert), reason == null ? "manual_escalation" : reason, actor);
        return alert;
    }

    public Alert acknowledge(String alertId, String actor) {
        Alert alert = require(alertId);
        alert.acknowledge(actor, clock.instant());
        stateStore.recordEngagement(alert.getDefinitionId());
        log.info("Alert {} acknowledged by {}", alertId, actor);
        return alert;
    }

    public Alert resolve(String alertId, String resolution, String actor) {
        Alert alert = require(alertId);
        resolve(alert, resolution, actor, false, clock.instant());
        return alert;
    }

    /**
     * Operator suppression, allowed only for definitions with suppression enabled.
     */
    public Alert suppress(String alertId, String actor, String reason) {
        Alert alert = require(alertId);
        AlertDefinition definition = definitionOf(alert);
        if (!definition.isSuppressionEnabled()) {
            throw new IllegalAlertTransitionException(alertId, alert.getStatus(),
                    "suppress (suppression disabled for " + definition.getId() + ")");
        }
        alert.suppress(reason == null ? "manual_suppression" : reason, actor, clock.instant());
        metricsCollector.recordSuppressed();
        log.info("Alert {} suppressed by {}", alertId, actor);
        return alert;
    }

    public Optional<Alert> find(String alertId) {
        return alertStore.findById(alertId);
    }

    // ==================== Auto Resolution ====================

    /**
     * Resolves ACTIVE alerts whose timeout elapsed or whose recovery conditions hold.
     *
     * @return number of alerts resolved
     */
    public int runAutoResolution(Instant now) {
        int resolved = 0;
        for (Alert alert : alertStore.findByStatus(AlertStatus.ACTIVE)) {
            Optional<AlertDefinition> definition = definitionRegistry.findById(alert.getDefinitionId());
            if (definition.isEmpty() || !definition.get().getAutoResolve().isEnabled()) {
                continue;
            }
            try {
                if (tryAutoResolve(alert, definition.get().getAutoResolve(), now)) {
                    resolved++;
                }
            } catch (IllegalAlertTransitionException e) {
                log.debug("Alert {} changed state during auto-resolution: {}", alert.getId(), e.getMessage());
            }
        }
        if (resolved > 0) {
            log.info("Auto-resolved {} alerts", resolved);
        }
        return resolved;
    }

    // --- Private helpers ---

    private boolean tryAutoResolve(Alert alert, AutoResolvePolicy policy, Instant now) {
        if (policy.hasTimeout() && Duration.between(alert.getTriggeredAt(), now).compareTo(policy.getTimeout()) > 0) {
            resolve(alert, AUTO_RESOLVED_TIMEOUT, SYSTEM_ACTOR, true, now);
            alert.recordAutoResolutionAttempt(true);
            return true;
        }
        if (policy.getConditions().isEmpty()) {
            return false;
        }
        Map<String, Object> state = systemStateProvider.currentState(alert);
        boolean met = conditionEvaluator.matchesAll(policy.getConditions(), state) && !state.isEmpty();
        if (met) {
            resolve(alert, AUTO_RESOLVED_CONDITIONS, SYSTEM_ACTOR, true, now);
        }
        alert.recordAutoResolutionAttempt(met);
        return met;
    }

    private void resolve(Alert alert, String resolution, String actor, boolean automatic, Instant now) {
        alert.resolve(resolution, actor, now);
        boolean falsePositive = FALSE_POSITIVE.equals(resolution);
        deduplicationIndex.unregister(alert);
        metricsCollector.recordResolution(alert, automatic, falsePositive);
        stateStore.recordResolution(alert.getDefinitionId(), falsePositive,
                Duration.between(alert.getTriggeredAt(), now));
        log.info("Alert {} resolved by {}: {}", alert.getId(), actor, resolution);
    }

    private Alert require(String alertId) {
        return alertStore.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    private AlertDefinition definitionOf(Alert alert) {
        return definitionRegistry.findById(alert.getDefinitionId())
                .orElseThrow(() -> new AlertProcessingException(
                        "Definition no longer registered: " + alert.getDefinitionId(),
                        alert.getDefinitionId(), "DEFINITION_NOT_FOUND"));
    }
}
