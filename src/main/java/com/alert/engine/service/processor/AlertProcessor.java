package com.alert.engine.service.processor;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AlertLifecycleManager;
import com.alert.engine.service.alert.AlertNotFoundException;
import com.alert.engine.service.alert.AlertProcessingException;
import com.alert.engine.service.alert.IllegalAlertTransitionException;
import com.alert.engine.service.alert.InMemorySystemStateProvider;
import com.alert.engine.service.config.AlertEngineConfig;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.AlertDefinitionRegistry;
import com.alert.engine.service.definition.AlertType;
import com.alert.engine.service.enrich.AlertFactory;
import com.alert.engine.service.enrich.RiskScoreCalculator;
import com.alert.engine.service.evaluate.ConditionEvaluator;
import com.alert.engine.service.fingerprint.FingerprintGenerator;
import com.alert.engine.service.metrics.AlertMetrics;
import com.alert.engine.service.metrics.HealthReport;
import com.alert.engine.service.metrics.MetricsCollector;
import com.alert.engine.service.notify.NotificationService;
import com.alert.engine.service.notify.SecurityEvent;
import com.alert.engine.service.notify.SecurityEventSink;
import com.alert.engine.service.throttle.ThrottlingDecision;
import com.alert.engine.service.throttle.ThrottlingEngine;
import com.alert.engine.service.throttle.ThrottlingState;
import com.alert.engine.service.throttle.ThrottlingStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the alert pipeline.
 *
 * Selects the definition, evaluates its trigger, builds the candidate, then throttles and
 * commits it under the rule's lock. Notifications, immediate escalation and security forwarding
 * happen after the lock is released and never change the outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertProcessor {

    private final AlertEngineConfig engineConfig;
    private final AlertDefinitionRegistry definitionRegistry;
    private final ConditionEvaluator conditionEvaluator;
    private final AlertFactory alertFactory;
    private final FingerprintGenerator fingerprintGenerator;
    private final ThrottlingStateStore stateStore;
    private final ThrottlingEngine throttlingEngine;
    private final AlertLifecycleManager lifecycleManager;
    private final MetricsCollector metricsCollector;
    private final NotificationService notificationService;
    private final SecurityEventSink securityEventSink;
    private final RiskScoreCalculator riskScoreCalculator;
    private final InMemorySystemStateProvider systemStateProvider;
    private final Clock clock;

    /**
     * Processes one event.
     *
     * @return the id of the new alert, the id of the alert it was merged into, or empty when no
     *         alert results (no definition, conditions unmet, inactive hours, suppressed)
     * @throws AlertProcessingException when fingerprinting, throttling or persistence fails
     */
    public Optional<String> process(AlertType eventType, Map<String, Object> data, ProcessOptions options) {
        return metricsCollector.processingTimer().record(() ->
                doProcess(eventType, data == null ? Map.of() : data, options == null ? ProcessOptions.defaults() : options));
    }

    public Optional<String> process(AlertType eventType, Map<String, Object> data) {
        return process(eventType, data, ProcessOptions.defaults());
    }

    public AlertMetrics getStats() {
        return metricsCollector.snapshot();
    }

    public HealthReport healthCheck() {
        return metricsCollector.healthCheck();
    }

    public Optional<Alert> findAlert(String alertId) {
        return lifecycleManager.find(alertId);
    }

    /**
     * Feeds the system state that auto-resolve conditions of the given alert subject are checked against.
     */
    public void recordSystemState(String definitionId, String fingerprint, Map<String, Object> state) {
        if (definitionRegistry.findById(definitionId).isEmpty()) {
            throw new IllegalArgumentException("Unknown alert definition: " + definitionId);
        }
        systemStateProvider.record(definitionId, fingerprint, state);
    }

    /**
     * Fingerprint the given event data would have under the definition.
     */
    public String fingerprintFor(String definitionId, Map<String, Object> eventData) {
        AlertDefinition definition = definitionRegistry.findById(definitionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown alert definition: " + definitionId));
        return fingerprintGenerator.fingerprint(definition, eventData);
    }

    // ==================== Pipeline ====================

    private Optional<String> doProcess(AlertType eventType, Map<String, Object> data, ProcessOptions options) {
        if (!engineConfig.isEnabled()) {
            log.debug("Alert engine disabled, ignoring {} event", eventType);
            return Optional.empty();
        }

        Optional<AlertDefinition> match = selectDefinition(eventType, data);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        AlertDefinition definition = match.get();

        Alert candidate = alertFactory.create(definition, data, options);
        Instant now = clock.instant();

        if (!options.isForceProcess() && !definition.getSchedule().isActiveAt(now)) {
            log.debug("Definition {} outside active hours, event dropped", definition.getId());
            return Optional.empty();
        }

        Commit commit = stateStore.computeLocked(definition.getId(), now,
                state -> throttleAndCommit(candidate, definition, state, options, now));

        if (commit.admitted() != null) {
            afterAdmission(commit.admitted(), definition);
        }
        return Optional.ofNullable(commit.alertId());
    }

    private Optional<AlertDefinition> selectDefinition(AlertType eventType, Map<String, Object> data) {
        try {
            Optional<AlertDefinition> definition = definitionRegistry.findFirstEnabled(eventType);
            if (definition.isEmpty()) {
                log.warn("No alert definition found for event type {}", eventType.getValue());
                return Optional.empty();
            }
            if (!conditionEvaluator.matches(definition.get(), data)) {
                log.debug("Alert conditions not met for definition {}", definition.get().getId());
                return Optional.empty();
            }
            return definition;
        } catch (RuntimeException e) {
            log.warn("Definition lookup failed for event type {}: {}", eventType, e.getMessage());
            return Optional.empty();
        }
    }

    private Commit throttleAndCommit(Alert candidate, AlertDefinition definition, ThrottlingState state,
                                     ProcessOptions options, Instant now) {
        if (options.isBypassThrottling()) {
            log.debug("Throttling bypassed for alert {}", candidate.getId());
            return Commit.admitted(lifecycleManager.admit(candidate));
        }

        ThrottlingDecision decision = throttlingEngine.decide(candidate, definition, state, now);
        if (decision.outcome() == ThrottlingDecision.Outcome.DEDUPLICATE) {
            String existingId = ((ThrottlingDecision.Deduplicate) decision).existingAlertId();
            try {
                lifecycleManager.mergeDuplicate(existingId, candidate);
                metricsCollector.recordDeduplicated();
                return Commit.merged(existingId);
            } catch (IllegalAlertTransitionException | AlertNotFoundException e) {
                log.debug("Duplicate target {} is no longer live, throttling {} as new: {}",
                        existingId, candidate.getId(), e.getMessage());
                decision = throttlingEngine.decideWithoutDeduplication(candidate, definition, state, now);
            }
        }
        return commit(decision, candidate, definition);
    }

    private Commit commit(ThrottlingDecision decision, Alert candidate, AlertDefinition definition) {
        if (decision.outcome() == ThrottlingDecision.Outcome.SUPPRESS) {
            metricsCollector.recordThrottled();
            log.debug("Alert for {} throttled: {}", definition.getId(),
                    ((ThrottlingDecision.Suppress) decision).reason());
            return Commit.none();
        }
        return Commit.admitted(lifecycleManager.admit(candidate));
    }

    private void afterAdmission(Alert alert, AlertDefinition definition) {
        metricsCollector.recordGenerated(alert);

        if (engineConfig.getFeatures().isNotificationsEnabled()) {
            notificationService.dispatch(alert, definition);
        }

        lifecycleManager.checkImmediateEscalation(alert, definition);

        if (engineConfig.getFeatures().isSecurityForwardingEnabled()) {
            forwardSecurityEvent(alert, definition);
        }
    }

    private void forwardSecurityEvent(Alert alert, AlertDefinition definition) {
        try {
            securityEventSink.record(SecurityEvent.builder()
                    .alertId(alert.getId())
                    .definitionId(definition.getId())
                    .eventType(alert.getType().getValue())
                    .title(alert.getTitle())
                    .priority(alert.getPriority().name())
                    .severity(alert.getSeverity())
                    .riskScore(riskScoreCalculator.score(alert))
                    .securityRelevant(alert.isSecurityRelevant())
                    .threatLevel(alert.getThreatLevel())
                    .complianceRelevant(definition.isComplianceRelevant())
                    .sourceSystem(alert.getSourceSystem())
                    .sourceId(alert.getSourceId())
                    .storeId(alert.getStoreId())
                    .timestamp(alert.getTriggeredAt())
                    .details(alert.getDetails())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Security event forwarding failed for alert {}: {}", alert.getId(), e.getMessage());
        }
    }

    /**
     * Result of the locked section: the id to return and, for fresh admissions, the new alert.
     */
    private record Commit(String alertId, Alert admitted) {

        static Commit none() {
            return new Commit(null, null);
        }

        static Commit merged(String existingId) {
            return new Commit(existingId, null);
        }

        static Commit admitted(Alert alert) {
            return new Commit(alert.getId(), alert);
        }
    }
}
