package com.alert.engine.service.metrics;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time snapshot of engine counters and derived ratios.
 */
@Value
@Builder
public class AlertMetrics {

    long totalAlertsGenerated;
    long alertsThrottled;
    long alertsDeduplicated;
    long alertsEscalated;
    long alertsSuppressed;
    long alertsResolved;
    long alertsAutoResolved;
    long criticalAlerts;
    long activeCriticalAlerts;
    long activeAlerts;
    int activeThrottlingStates;

    /**
     * Share of resolutions marked {@code false_positive}.
     */
    double falsePositiveRate;

    double averageResolutionTimeMs;

    /**
     * Admissions in the trailing hour, capped.
     */
    int alertFatigue;

    /**
     * Share of incoming alerts that throttling or deduplication absorbed.
     */
    double throttlingEffectiveness;

    double notificationDeliveryRate;
    double estimatedCostSavings;
    Instant lastUpdated;
}
