package com.alert.engine.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for alert details.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertResponse {

    private String id;
    private String definitionId;
    private String type;
    private String title;
    private String message;
    private String status;
    private String priority;
    private int severity;
    private String fingerprint;
    private String sourceSystem;
    private String sourceId;
    private String storeId;
    private Instant triggeredAt;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private Instant resolvedAt;
    private String resolvedBy;
    private String resolution;
    private Instant escalatedAt;
    private int escalationLevel;
    private int originalCount;
    private List<String> relatedAlerts;
    private List<String> notificationChannels;
    private boolean throttled;
    private String throttleReason;
    private String businessImpact;
    private long affectedUsers;
    private long affectedOrders;
    private double estimatedRevenueLoss;
    private boolean securityRelevant;
    private String threatLevel;
    private Map<String, Object> details;
    private List<EscalationResponse> escalationHistory;
    private List<AuditResponse> auditTrail;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EscalationResponse {
        private int level;
        private Instant escalatedAt;
        private List<String> escalatedTo;
        private String reason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuditResponse {
        private Instant timestamp;
        private String action;
        private String actor;
        private Map<String, Object> details;
    }
}
