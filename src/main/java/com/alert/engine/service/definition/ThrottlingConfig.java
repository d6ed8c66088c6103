package com.alert.engine.service.definition;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Throttling parameters of a definition. Which fields matter depends on the strategy.
 */
@Value
@Builder(toBuilder = true)
public class ThrottlingConfig {

    @Builder.Default
    Duration timeWindow = Duration.ofHours(1);

    @Builder.Default
    int maxAlertsInWindow = 5;

    @Builder.Default
    Duration cooldownPeriod = Duration.ofMinutes(30);

    /**
     * Minimum fingerprint similarity (0-1) treated as "the same alert".
     */
    @Builder.Default
    double similarityThreshold = 0.8;

    @Builder.Default
    int escalationThreshold = 3;

    /**
     * Lets the adaptive strategy suppress on feedback; without it only the window limit applies.
     */
    @Builder.Default
    boolean adaptiveLearning = false;
}
