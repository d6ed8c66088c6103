package com.alert.engine.service.api.health;

import com.alert.engine.service.metrics.AlertMetrics;
import com.alert.engine.service.metrics.HealthReport;
import com.alert.engine.service.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the alert engine.
 *
 * Reports DOWN only when the engine status is critical.
 */
@Component
@RequiredArgsConstructor
public class AlertEngineHealthIndicator implements HealthIndicator {

    private final MetricsCollector metricsCollector;

    @Override
    public Health health() {
        HealthReport report = metricsCollector.healthCheck();
        AlertMetrics metrics = report.metrics();

        Health.Builder builder = report.isCritical()
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("status", report.status())
                .withDetail("issues", report.issues())
                .withDetail("activeAlerts", metrics.getActiveAlerts())
                .withDetail("activeCriticalAlerts", metrics.getActiveCriticalAlerts())
                .withDetail("activeThrottlingStates", metrics.getActiveThrottlingStates())
                .withDetail("alertFatigue", metrics.getAlertFatigue())
                .build();
    }
}
