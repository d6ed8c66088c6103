package com.alert.engine.service.alert;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of an alert's append-only audit trail.
 */
public record AuditEntry(Instant timestamp, String action, String actor, Map<String, Object> details) {

    public static final String ALERT_TRIGGERED = "alert_triggered";
    public static final String ALERT_ADMITTED = "alert_admitted";
    public static final String ALERT_DEDUPLICATED = "alert_deduplicated";
    public static final String ALERT_ESCALATED = "alert_escalated";
    public static final String ALERT_ACKNOWLEDGED = "alert_acknowledged";
    public static final String ALERT_RESOLVED = "alert_resolved";
    public static final String ALERT_SUPPRESSED = "alert_suppressed";
    public static final String NOTIFICATIONS_SENT = "notifications_sent";
    public static final String AUTO_RESOLUTION_ATTEMPTED = "auto_resolution_attempted";

    public AuditEntry {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
