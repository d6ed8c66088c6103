package com.alert.engine.service.metrics;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AlertStatus;
import com.alert.engine.service.alert.AlertStore;
import com.alert.engine.service.config.AlertEngineConfig;
import com.alert.engine.service.config.MetricsConfig;
import com.alert.engine.service.throttle.ThrottlingStateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.LongAdder;

/**
 * Records pipeline outcomes on the Micrometer counters and derives the metrics snapshot and health.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsCollector {

    static final double FATIGUE_WARNING_THRESHOLD = 70;
    static final double FALSE_POSITIVE_DEGRADED_THRESHOLD = 0.3;
    static final long CRITICAL_ALERT_THRESHOLD = 20;

    private static final Duration FATIGUE_WINDOW = Duration.ofHours(1);

    private final MetricsConfig metricsConfig;
    private final AlertEngineConfig engineConfig;
    private final ThrottlingStateStore stateStore;
    private final AlertStore alertStore;
    private final Clock clock;

    private final Deque<Instant> recentAdmissions = new ConcurrentLinkedDeque<>();
    private final LongAdder resolutionTimeMsTotal = new LongAdder();

    // ==================== Recording ====================

    public void recordGenerated(Alert alert) {
        metricsConfig.getAlertsGenerated().increment();
        if (alert.getPriority() != null && alert.getPriority().isCriticalOrAbove()) {
            metricsConfig.getCriticalAlerts().increment();
        }
        Instant now = clock.instant();
        recentAdmissions.addLast(now);
        trimAdmissions(now);
    }

    public void recordThrottled() {
        metricsConfig.getAlertsThrottled().increment();
    }

    public void recordDeduplicated() {
        metricsConfig.getAlertsDeduplicated().increment();
    }

    public void recordEscalated() {
        metricsConfig.getAlertsEscalated().increment();
    }

    public void recordSuppressed() {
        metricsConfig.getAlertsSuppressed().increment();
    }

    public void recordResolution(Alert alert, boolean automatic, boolean falsePositive) {
        metricsConfig.getAlertsResolved().increment();
        if (automatic) {
            metricsConfig.getAlertsAutoResolved().increment();
        }
        if (falsePositive) {
            metricsConfig.getFalsePositives().increment();
        }
        if (alert.getResolvedAt() != null && alert.getTriggeredAt() != null) {
            resolutionTimeMsTotal.add(Duration.between(alert.getTriggeredAt(), alert.getResolvedAt()).toMillis());
        }
    }

    public void recordNotification(boolean delivered) {
        (delivered ? metricsConfig.getNotificationsDelivered() : metricsConfig.getNotificationsFailed()).increment();
    }

    public Timer processingTimer() {
        return metricsConfig.getProcessingTimer();
    }

    // ==================== Snapshot ====================

    public AlertMetrics snapshot() {
        Instant now = clock.instant();
        trimAdmissions(now);

        long generated = count(metricsConfig.getAlertsGenerated());
        long throttled = count(metricsConfig.getAlertsThrottled());
        long deduplicated = count(metricsConfig.getAlertsDeduplicated());
        long resolved = count(metricsConfig.getAlertsResolved());
        long falsePositives = count(metricsConfig.getFalsePositives());
        long delivered = count(metricsConfig.getNotificationsDelivered());
        long failed = count(metricsConfig.getNotificationsFailed());

        Collection<Alert> alerts = alertStore.findAll();
        long activeAlerts = alerts.stream().filter(alert -> !alert.isResolved()).count();
        long activeCritical = alerts.stream()
                .filter(alert -> !alert.isResolved() && alert.getStatus() != AlertStatus.SUPPRESSED)
                .filter(alert -> alert.getPriority() != null && alert.getPriority().isCriticalOrAbove())
                .count();

        long absorbed = throttled + deduplicated;
        return AlertMetrics.builder()
                .totalAlertsGenerated(generated)
                .alertsThrottled(throttled)
                .alertsDeduplicated(deduplicated)
                .alertsEscalated(count(metricsConfig.getAlertsEscalated()))
                .alertsSuppressed(count(metricsConfig.getAlertsSuppressed()))
                .alertsResolved(resolved)
                .alertsAutoResolved(count(metricsConfig.getAlertsAutoResolved()))
                .criticalAlerts(count(metricsConfig.getCriticalAlerts()))
                .activeCriticalAlerts(activeCritical)
                .activeAlerts(activeAlerts)
                .activeThrottlingStates(stateStore.size())
                .falsePositiveRate(ratio(falsePositives, resolved))
                .averageResolutionTimeMs(resolved == 0 ? 0.0 : (double) resolutionTimeMsTotal.sum() / resolved)
                .alertFatigue(Math.min(recentAdmissions.size(), engineConfig.getMetrics().getFatigueCap()))
                .throttlingEffectiveness(ratio(absorbed, generated + absorbed))
                .notificationDeliveryRate(ratio(delivered, delivered + failed))
                .estimatedCostSavings(absorbed * engineConfig.getMetrics().getCostPerSuppressedAlert())
                .lastUpdated(now)
                .build();
    }

    /**
     * Derives the engine status from the current snapshot. Later checks take precedence.
     */
    public HealthReport healthCheck() {
        AlertMetrics metrics = snapshot();
        String status = HealthReport.HEALTHY;
        List<String> issues = new ArrayList<>();

        if (metrics.getAlertFatigue() > FATIGUE_WARNING_THRESHOLD) {
            status = HealthReport.WARNING;
            issues.add("High alert fatigue: " + metrics.getAlertFatigue() + " alerts in the last hour");
        }
        if (metrics.getFalsePositiveRate() > FALSE_POSITIVE_DEGRADED_THRESHOLD) {
            status = HealthReport.DEGRADED;
            issues.add(String.format("High false positive rate: %.2f", metrics.getFalsePositiveRate()));
        }
        if (metrics.getActiveCriticalAlerts() > CRITICAL_ALERT_THRESHOLD) {
            status = HealthReport.CRITICAL;
            issues.add("Too many critical alerts: " + metrics.getActiveCriticalAlerts());
        }
        if (!HealthReport.HEALTHY.equals(status)) {
            log.warn("Alert engine health is {}: {}", status, issues);
        }
        return new HealthReport(status, issues, metrics);
    }

    // --- Private helpers ---

    private void trimAdmissions(Instant now) {
        Instant cutoff = now.minus(FATIGUE_WINDOW);
        Instant head;
        while ((head = recentAdmissions.peekFirst()) != null && head.isBefore(cutoff)) {
            recentAdmissions.pollFirst();
        }
    }

    private static long count(Counter counter) {
        return (long) counter.count();
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
