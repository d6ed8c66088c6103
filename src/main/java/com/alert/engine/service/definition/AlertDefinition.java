package com.alert.engine.service.definition;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable alert rule: what triggers it, how it is throttled and deduplicated, who is notified.
 *
 * Definitions come from an {@link AlertDefinitionSource} and are read-only to the engine.
 */
@Value
@Builder(toBuilder = true)
public class AlertDefinition {

    String id;
    AlertType eventType;
    String name;
    String description;

    @Singular
    List<TriggerCondition> triggerConditions;

    @Builder.Default
    AlertPriority priority = AlertPriority.NORMAL;

    @Builder.Default
    int severity = 5;

    @Builder.Default
    String businessImpact = "medium";

    @Builder.Default
    ThrottlingStrategyType throttlingStrategy = ThrottlingStrategyType.TIME_BASED;

    @Builder.Default
    ThrottlingConfig throttlingConfig = ThrottlingConfig.builder().build();

    @Builder.Default
    DeduplicationSettings deduplication = DeduplicationSettings.disabled();

    @Singular
    List<String> notificationChannels;

    @Singular
    List<String> recipients;

    @Singular
    List<String> escalationRecipients;

    @Builder.Default
    boolean suppressionEnabled = true;

    @Builder.Default
    ActiveSchedule schedule = ActiveSchedule.always();

    @Builder.Default
    AutoResolvePolicy autoResolve = AutoResolvePolicy.disabled();

    boolean auditRequired;
    boolean complianceRelevant;
    int retentionPeriodDays;

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    String createdBy = "system";

    /**
     * Lists the invariant violations of this definition; empty when it is usable.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (id == null || id.isBlank()) {
            problems.add("id is required");
        }
        if (eventType == null) {
            problems.add("eventType is required");
        }
        if (enabled && triggerConditions.isEmpty()) {
            problems.add("enabled definition needs at least one trigger condition");
        }
        if (severity < 1 || severity > 10) {
            problems.add("severity must be between 1 and 10");
        }
        if (throttlingConfig == null) {
            problems.add("throttlingConfig is required");
        } else {
            if (throttlingConfig.getEscalationThreshold() < 1) {
                problems.add("escalationThreshold must be at least 1");
            }
            double similarity = throttlingConfig.getSimilarityThreshold();
            if (similarity < 0.0 || similarity > 1.0) {
                problems.add("similarityThreshold must be within [0, 1]");
            }
        }
        if (deduplication != null && deduplication.isEnabled() && deduplication.getFields().isEmpty()) {
            problems.add("deduplication needs at least one field when enabled");
        }
        return problems;
    }
}
