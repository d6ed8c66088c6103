package com.alert.engine.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Background maintenance job configuration.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "alert.scheduler")
public class SchedulerConfig {

    /**
     * Throttling state idle longer than this is removed.
     */
    private Duration stateTtl = Duration.ofHours(24);

    /**
     * Interval of the state cleanup job in milliseconds.
     */
    private long cleanupIntervalMs = 3_600_000;

    /**
     * Interval of the auto-resolution sweep in milliseconds.
     */
    private long autoResolveIntervalMs = 300_000;

    /**
     * Interval of the adaptive metric decay job in milliseconds.
     */
    private long adaptiveDecayIntervalMs = 900_000;
}
