package com.alert.engine.service.metrics;

import java.util.List;

/**
 * Engine health: {@code healthy}, {@code warning}, {@code degraded} or {@code critical}.
 */
public record HealthReport(String status, List<String> issues, AlertMetrics metrics) {

    public static final String HEALTHY = "healthy";
    public static final String WARNING = "warning";
    public static final String DEGRADED = "degraded";
    public static final String CRITICAL = "critical";

    public HealthReport {
        issues = List.copyOf(issues);
    }

    public boolean isCritical() {
        return CRITICAL.equals(status);
    }
}
