package com.alert.engine.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the alert engine.
 *
 * Provides counters for every pipeline outcome, a processing timer and store gauges.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter alertsGenerated;
    private final Counter alertsThrottled;
    private final Counter alertsDeduplicated;
    private final Counter alertsEscalated;
    private final Counter alertsSuppressed;
    private final Counter criticalAlerts;
    private final Counter alertsResolved;
    private final Counter alertsAutoResolved;
    private final Counter falsePositives;
    private final Counter notificationsDelivered;
    private final Counter notificationsFailed;

    // Timers
    private final Timer processingTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.alertsGenerated = counter("alert.generated", "Number of alerts admitted");
        this.alertsThrottled = counter("alert.throttled", "Number of events suppressed by throttling");
        this.alertsDeduplicated = counter("alert.deduplicated", "Number of events merged into an existing alert");
        this.alertsEscalated = counter("alert.escalated", "Number of escalations performed");
        this.alertsSuppressed = counter("alert.suppressed", "Number of alerts suppressed by operators");
        this.criticalAlerts = counter("alert.critical", "Number of critical or emergency alerts admitted");
        this.alertsResolved = counter("alert.resolved", "Number of alerts resolved");
        this.alertsAutoResolved = counter("alert.resolved.auto", "Number of alerts resolved automatically");
        this.falsePositives = counter("alert.resolved.false_positive", "Number of alerts resolved as false positives");
        this.notificationsDelivered = counter("alert.notification.delivered", "Number of notifications delivered");
        this.notificationsFailed = counter("alert.notification.failed", "Number of failed notification attempts");

        this.processingTimer = Timer.builder("alert.processing.duration")
                .description("Time taken to process an event")
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
                .description(description)
                .register(registry);
    }
}
