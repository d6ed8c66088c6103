package com.alert.engine.service.throttle;

import lombok.Getter;

import java.time.Duration;

/**
 * Feedback signals for the adaptive strategy, each clamped to [0, 1].
 *
 * Accessed under the owning {@link ThrottlingState}'s lock.
 */
@Getter
public class AdaptiveMetrics {

    static final double FALSE_POSITIVE_STEP = 0.1;
    static final double CONFIRMED_STEP = 0.05;
    static final double ENGAGEMENT_STEP = 0.1;
    static final double RESOLUTION_TIME_WEIGHT = 0.2;
    static final Duration RESOLUTION_TIME_SCALE = Duration.ofDays(1);

    private double falsePositiveRate;
    /**
     * Moving average of time to resolve, as a fraction of a day.
     */
    private double resolutionTime;
    private double userEngagement;

    public void setFalsePositiveRate(double value) {
        this.falsePositiveRate = clamp(value);
    }

    public void setResolutionTime(double value) {
        this.resolutionTime = clamp(value);
    }

    public void setUserEngagement(double value) {
        this.userEngagement = clamp(value);
    }

    /**
     * Moves the false-positive rate up for a false-positive resolution and down otherwise,
     * and folds the time to resolve into the moving average.
     */
    void recordResolution(boolean falsePositive, Duration timeToResolve) {
        setFalsePositiveRate(falsePositive
                ? falsePositiveRate + FALSE_POSITIVE_STEP
                : falsePositiveRate - CONFIRMED_STEP);
        if (timeToResolve != null && !timeToResolve.isNegative()) {
            double sample = Math.min(1.0, (double) timeToResolve.toMillis() / RESOLUTION_TIME_SCALE.toMillis());
            setResolutionTime(resolutionTime + RESOLUTION_TIME_WEIGHT * (sample - resolutionTime));
        }
    }

    void recordEngagement() {
        setUserEngagement(userEngagement + ENGAGEMENT_STEP);
    }

    /**
     * Periodic relaxation: fewer assumed false positives, more assumed engagement.
     */
    void decay(double step) {
        setFalsePositiveRate(falsePositiveRate - step);
        setUserEngagement(userEngagement + step);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
