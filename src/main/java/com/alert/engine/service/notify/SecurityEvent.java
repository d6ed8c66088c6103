package com.alert.engine.service.notify;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record forwarded to the security event sink for every admitted alert.
 */
@Value
@Builder
public class SecurityEvent {

    String alertId;
    String definitionId;
    String eventType;
    String title;
    String priority;
    int severity;
    int riskScore;
    boolean securityRelevant;
    String threatLevel;
    boolean complianceRelevant;
    String sourceSystem;
    String sourceId;
    String storeId;
    Instant timestamp;
    Map<String, Object> details;
}
