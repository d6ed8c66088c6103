package com.alert.engine.service.definition;

import com.alert.engine.service.config.AlertCatalogConfig;
import com.alert.engine.service.config.AlertCatalogConfig.ConditionProperties;
import com.alert.engine.service.config.AlertCatalogConfig.DefinitionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * Definition source backed by the {@code alert.catalog} configuration.
 *
 * Entries that cannot be converted are skipped with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PropertiesAlertDefinitionSource implements AlertDefinitionSource {

    private final AlertCatalogConfig catalogConfig;

    @Override
    public List<AlertDefinition> loadDefinitions() {
        List<AlertDefinition> definitions = new ArrayList<>();
        for (DefinitionProperties properties : catalogConfig.getDefinitions()) {
            try {
                definitions.add(toDefinition(properties));
            } catch (IllegalArgumentException | DateTimeException e) {
                log.warn("Skipping catalog entry {}: {}", properties.getId(), e.getMessage());
            }
        }
        log.info("Loaded {} alert definitions from configuration", definitions.size());
        return definitions;
    }

    // --- Private helpers ---

    private AlertDefinition toDefinition(DefinitionProperties p) {
        AlertCatalogConfig.ThrottlingProperties t = p.getThrottling();
        AlertCatalogConfig.DeduplicationProperties d = p.getDeduplication();
        AlertCatalogConfig.ScheduleProperties s = p.getSchedule();
        AlertCatalogConfig.AutoResolveProperties a = p.getAutoResolve();

        return AlertDefinition.builder()
                .id(p.getId())
                .eventType(AlertType.fromValue(p.getEventType()))
                .name(p.getName())
                .description(p.getDescription())
                .triggerConditions(toConditions(p.getTriggerConditions()))
                .priority(AlertPriority.valueOf(upper(p.getPriority())))
                .severity(p.getSeverity())
                .businessImpact(p.getBusinessImpact())
                .throttlingStrategy(ThrottlingStrategyType.valueOf(upper(p.getThrottlingStrategy())))
                .throttlingConfig(ThrottlingConfig.builder()
                        .timeWindow(t.getTimeWindow())
                        .maxAlertsInWindow(t.getMaxAlertsInWindow())
                        .cooldownPeriod(t.getCooldownPeriod())
                        .similarityThreshold(t.getSimilarityThreshold())
                        .escalationThreshold(t.getEscalationThreshold())
                        .adaptiveLearning(t.isAdaptiveLearning())
                        .build())
                .deduplication(DeduplicationSettings.builder()
                        .enabled(d.isEnabled())
                        .fields(d.getFields())
                        .window(d.getWindow())
                        .build())
                .notificationChannels(p.getNotificationChannels())
                .recipients(p.getRecipients())
                .escalationRecipients(p.getEscalationRecipients())
                .suppressionEnabled(p.isSuppressionEnabled())
                .schedule(ActiveSchedule.builder()
                        .start(LocalTime.parse(s.getStart()))
                        .end(LocalTime.parse(s.getEnd()))
                        .activeDays(new HashSet<>(s.getDays()))
                        .timezone(ZoneId.of(s.getTimezone()))
                        .build())
                .autoResolve(AutoResolvePolicy.builder()
                        .enabled(a.isEnabled())
                        .conditions(toConditions(a.getConditions()))
                        .timeout(a.getTimeout())
                        .build())
                .auditRequired(p.isAuditRequired())
                .complianceRelevant(p.isComplianceRelevant())
                .retentionPeriodDays(p.getRetentionPeriodDays())
                .enabled(p.isEnabled())
                .createdBy(p.getCreatedBy())
                .build();
    }

    private List<TriggerCondition> toConditions(List<ConditionProperties> conditions) {
        return conditions.stream()
                .map(c -> TriggerCondition.of(c.getField(), c.getOperator(), c.getValue()))
                .toList();
    }

    private static String upper(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing enum value");
        }
        return value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    }
}
