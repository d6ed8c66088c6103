package com.alert.engine.service.alert;

import com.alert.engine.service.definition.AlertPriority;
import com.alert.engine.service.definition.AlertType;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A materialized alert.
 *
 * Identity and enrichment fields are fixed at creation. Lifecycle fields change only through the
 * synchronized mutators below, which also enforce the allowed status transitions. Collection
 * getters return copies.
 */
@Getter
public class Alert {

    private static final Set<AlertStatus> ACKNOWLEDGEABLE = EnumSet.of(AlertStatus.ACTIVE, AlertStatus.ESCALATED);

    private final String id;
    private final String definitionId;
    private final AlertType type;
    private final String title;
    private final String message;
    private final String sourceSystem;
    private final String sourceId;
    private final String storeId;
    private final AlertPriority priority;
    private final int severity;
    private final String fingerprint;
    private final Instant triggeredAt;

    private final String businessImpact;
    private final long affectedUsers;
    private final long affectedOrders;
    private final double estimatedRevenueLoss;
    private final boolean securityRelevant;
    private final String threatLevel;

    private volatile AlertStatus status = AlertStatus.ACTIVE;
    private volatile Instant acknowledgedAt;
    private volatile String acknowledgedBy;
    private volatile Instant resolvedAt;
    private volatile String resolvedBy;
    private volatile String resolution;
    private volatile Instant escalatedAt;
    private volatile Instant lastNotificationAt;
    private volatile boolean throttled;
    private volatile String throttleReason;
    private volatile int originalCount = 1;
    private volatile boolean notificationsSent;
    private volatile int escalationLevel;
    private volatile boolean autoResolutionAttempted;
    private volatile boolean autoResolutionSuccessful;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Object> details;
    @Getter(lombok.AccessLevel.NONE)
    private final List<String> relatedAlerts = new ArrayList<>();
    @Getter(lombok.AccessLevel.NONE)
    private final List<String> notificationChannels = new ArrayList<>();
    @Getter(lombok.AccessLevel.NONE)
    private final List<EscalationRecord> escalationHistory = new ArrayList<>();
    @Getter(lombok.AccessLevel.NONE)
    private final List<AuditEntry> auditTrail = new ArrayList<>();

    @Builder
    private Alert(String id, String definitionId, AlertType type, String title, String message,
                  Map<String, Object> details, String sourceSystem, String sourceId, String storeId,
                  AlertPriority priority, int severity, String fingerprint, Instant triggeredAt,
                  String businessImpact, long affectedUsers, long affectedOrders,
                  double estimatedRevenueLoss, boolean securityRelevant, String threatLevel) {
        this.id = id;
        this.definitionId = definitionId;
        this.type = type;
        this.title = title;
        this.message = message;
        this.details = details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details);
        this.sourceSystem = sourceSystem;
        this.sourceId = sourceId;
        this.storeId = storeId;
        this.priority = priority;
        this.severity = severity;
        this.fingerprint = fingerprint;
        this.triggeredAt = triggeredAt;
        this.businessImpact = businessImpact;
        this.affectedUsers = affectedUsers;
        this.affectedOrders = affectedOrders;
        this.estimatedRevenueLoss = estimatedRevenueLoss;
        this.securityRelevant = securityRelevant;
        this.threatLevel = threatLevel;
    }

    // ==================== Collection Views ====================

    public synchronized Map<String, Object> getDetails() {
        return new LinkedHashMap<>(details);
    }

    public synchronized List<String> getRelatedAlerts() {
        return List.copyOf(relatedAlerts);
    }

    public synchronized List<String> getNotificationChannels() {
        return List.copyOf(notificationChannels);
    }

    public synchronized List<EscalationRecord> getEscalationHistory() {
        return List.copyOf(escalationHistory);
    }

    public synchronized List<AuditEntry> getAuditTrail() {
        return List.copyOf(auditTrail);
    }

    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }

    // ==================== Mutators ====================

    public synchronized void appendAudit(AuditEntry entry) {
        auditTrail.add(entry);
    }

    /**
     * Folds a duplicate event into this alert.
     */
    public synchronized void mergeDuplicate(String duplicateId, Map<String, Object> newDetails, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalAlertTransitionException(id, status, "merge duplicate into");
        }
        originalCount++;
        relatedAlerts.add(duplicateId);
        if (newDetails != null) {
            details.putAll(newDetails);
        }
        lastNotificationAt = now;
        auditTrail.add(new AuditEntry(now, AuditEntry.ALERT_DEDUPLICATED, "system", Map.of(
                "duplicateAlertId", duplicateId,
                "totalCount", originalCount)));
    }

    /**
     * Raises the escalation level by one and records who it went to.
     *
     * @return the record appended to the escalation history
     */
    public synchronized EscalationRecord escalate(List<String> escalatedTo, String reason, String actor, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalAlertTransitionException(id, status, "escalate");
        }
        String why = reason == null ? "unspecified" : reason;
        escalationLevel++;
        escalatedAt = now;
        status = AlertStatus.ESCALATED;
        EscalationRecord record = new EscalationRecord(escalationLevel, now, escalatedTo, why);
        escalationHistory.add(record);
        auditTrail.add(new AuditEntry(now, AuditEntry.ALERT_ESCALATED, actor, Map.of(
                "escalationLevel", escalationLevel,
                "reason", why,
                "escalatedTo", record.escalatedTo())));
        return record;
    }

    public synchronized void acknowledge(String actor, Instant now) {
        if (!ACKNOWLEDGEABLE.contains(status)) {
            throw new IllegalAlertTransitionException(id, status, "acknowledge");
        }
        status = AlertStatus.ACKNOWLEDGED;
        acknowledgedAt = now;
        acknowledgedBy = actor;
        auditTrail.add(new AuditEntry(now, AuditEntry.ALERT_ACKNOWLEDGED, actor, Map.of()));
    }

    public synchronized void resolve(String resolution, String actor, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalAlertTransitionException(id, status, "resolve");
        }
        status = AlertStatus.RESOLVED;
        resolvedAt = now;
        resolvedBy = actor;
        this.resolution = resolution;
        auditTrail.add(new AuditEntry(now, AuditEntry.ALERT_RESOLVED, actor, Map.of(
                "resolution", resolution == null ? "" : resolution)));
    }

    public synchronized void suppress(String reason, String actor, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalAlertTransitionException(id, status, "suppress");
        }
        status = AlertStatus.SUPPRESSED;
        throttled = true;
        throttleReason = reason;
        auditTrail.add(new AuditEntry(now, AuditEntry.ALERT_SUPPRESSED, actor, Map.of(
                "reason", reason == null ? "" : reason)));
    }

    /**
     * Records the channels that accepted a notification.
     */
    public synchronized void recordNotifications(List<String> deliveredChannels, int recipientCount, Instant now) {
        for (String channel : deliveredChannels) {
            if (!notificationChannels.contains(channel)) {
                notificationChannels.add(channel);
            }
        }
        notificationsSent = !notificationChannels.isEmpty();
        lastNotificationAt = now;
        auditTrail.add(new AuditEntry(now, AuditEntry.NOTIFICATIONS_SENT, "system", Map.of(
                "channels", List.copyOf(deliveredChannels),
                "recipients", recipientCount)));
    }

    public synchronized void recordAutoResolutionAttempt(boolean successful) {
        autoResolutionAttempted = true;
        autoResolutionSuccessful = successful;
    }
}
