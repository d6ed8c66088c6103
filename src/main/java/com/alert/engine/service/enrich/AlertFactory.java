package com.alert.engine.service.enrich;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AuditEntry;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.AlertType;
import com.alert.engine.service.fingerprint.FingerprintGenerator;
import com.alert.engine.service.processor.ProcessOptions;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds candidate alerts: title and message templates, fingerprint, business impact and
 * security classification.
 */
@Component
@RequiredArgsConstructor
public class AlertFactory {

    static final String THREAT_LOW = "low";
    static final String THREAT_MEDIUM = "medium";
    static final String THREAT_HIGH = "high";
    static final String THREAT_CRITICAL = "critical";

    static final double DEFAULT_PRICE = 100;
    static final double DEFAULT_DAILY_SALES = 10;
    static final double SYSTEM_DOWNTIME_COST = 1000;

    private static final Set<AlertType> SECURITY_TYPES = EnumSet.of(
            AlertType.SECURITY_INCIDENT, AlertType.USER_ACTIVITY_SUSPICIOUS, AlertType.SYSTEM_ERROR);
    private static final int FALLBACK_TITLE_LENGTH = 100;

    private final FingerprintGenerator fingerprintGenerator;
    private final StockSeverityClassifier stockSeverityClassifier;
    private final Clock clock;

    public Alert create(AlertDefinition definition, Map<String, Object> data, ProcessOptions options) {
        Instant now = clock.instant();
        AlertType type = definition.getEventType();

        Map<String, Object> details = new LinkedHashMap<>(data);
        if (type == AlertType.LOW_STOCK || type == AlertType.OUT_OF_STOCK) {
            Number quantity = number(data.get("quantity"));
            if (quantity != null) {
                details.put("stockSeverity", stockSeverityClassifier.classify(quantity.longValue()).name());
            }
        }

        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .definitionId(definition.getId())
                .type(type)
                .title(title(definition, data))
                .message(message(definition, data))
                .details(details)
                .sourceSystem(options.getSourceSystem())
                .sourceId(options.getSourceId())
                .storeId(options.getStoreId() != null ? options.getStoreId() : stringOrNull(data.get("storeId")))
                .priority(definition.getPriority())
                .severity(definition.getSeverity())
                .fingerprint(fingerprintGenerator.fingerprint(definition, data))
                .triggeredAt(now)
                .businessImpact(businessImpact(definition))
                .affectedUsers(count(data.get("affectedUsers")))
                .affectedOrders(count(data.get("affectedOrders")))
                .estimatedRevenueLoss(revenueLoss(type, data))
                .securityRelevant(SECURITY_TYPES.contains(type))
                .threatLevel(threatLevel(type, data))
                .build();

        alert.appendAudit(new AuditEntry(now, AuditEntry.ALERT_TRIGGERED, "system", Map.of(
                "definitionId", definition.getId(),
                "eventType", type.getValue())));
        return alert;
    }

    // ==================== Templates ====================

    String title(AlertDefinition definition, Map<String, Object> data) {
        return switch (definition.getEventType()) {
            case LOW_STOCK -> "Low Stock Alert: " + productLabel(data) + " (" + data.get("quantity") + " remaining)";
            case OUT_OF_STOCK -> "OUT OF STOCK: " + productLabel(data);
            case PRICE_CHANGE -> "Price Change Alert: " + productLabel(data)
                    + " (" + data.get("priceChangePercent") + "% change)";
            case SECURITY_INCIDENT -> "Security Incident: " + data.get("incidentType")
                    + " (Risk Score: " + data.get("riskScore") + ")";
            case SYSTEM_ERROR -> "System Error: " + data.get("component") + " - " + data.get("errorCode");
            default -> {
                String flattened = data.toString();
                yield definition.getName() + ": "
                        + flattened.substring(0, Math.min(FALLBACK_TITLE_LENGTH, flattened.length())) + "...";
            }
        };
    }

    String message(AlertDefinition definition, Map<String, Object> data) {
        String fields = data.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(", "));
        String base = definition.getDescription() == null ? definition.getName() : definition.getDescription();
        return base + "\n\nDetails: " + fields;
    }

    // ==================== Impact ====================

    String businessImpact(AlertDefinition definition) {
        return switch (definition.getEventType()) {
            case OUT_OF_STOCK -> "Product unavailable for purchase, potential sales loss";
            case LOW_STOCK -> "Limited inventory, may affect order fulfillment";
            case SECURITY_INCIDENT -> "Potential data breach or system compromise";
            case SYSTEM_ERROR -> "System functionality impaired, may affect user experience";
            case PRICE_CHANGE -> "Pricing strategy change, may affect competitiveness";
            default -> definition.getBusinessImpact();
        };
    }

    double revenueLoss(AlertType type, Map<String, Object> data) {
        double dailyRevenue = positiveOr(data.get("price"), DEFAULT_PRICE)
                * positiveOr(data.get("averageDailySales"), DEFAULT_DAILY_SALES);
        return switch (type) {
            case OUT_OF_STOCK -> dailyRevenue;
            case LOW_STOCK -> dailyRevenue * 0.2;
            case SYSTEM_ERROR -> SYSTEM_DOWNTIME_COST;
            default -> 0;
        };
    }

    String threatLevel(AlertType type, Map<String, Object> data) {
        if (type != AlertType.SECURITY_INCIDENT) {
            return THREAT_LOW;
        }
        Number risk = number(data.get("riskScore"));
        double score = risk == null ? 0 : risk.doubleValue();
        if (score >= 90) {
            return THREAT_CRITICAL;
        }
        if (score >= 70) {
            return THREAT_HIGH;
        }
        if (score >= 50) {
            return THREAT_MEDIUM;
        }
        return THREAT_LOW;
    }

    // --- Private helpers ---

    private static String productLabel(Map<String, Object> data) {
        Object name = data.get("productName");
        if (name != null && !name.toString().isBlank()) {
            return name.toString();
        }
        Object id = data.get("productId");
        return id == null ? "unknown" : id.toString();
    }

    private static long count(Object value) {
        Number number = number(value);
        return number == null ? 0 : Math.max(0, number.longValue());
    }

    private static double positiveOr(Object value, double fallback) {
        Number number = number(value);
        return number == null || number.doubleValue() == 0 ? fallback : number.doubleValue();
    }

    private static Number number(Object value) {
        if (value instanceof Number number) {
            return number;
        }
        if (value instanceof String text) {
            try {
                return Double.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
