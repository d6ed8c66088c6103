package com.alert.engine.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall configuration for the alert engine.
 *
 * Contains toggles, feature flags, adaptive throttling constants and escalation settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "alert")
public class AlertEngineConfig {

    /**
     * Enable or disable event processing. When disabled every event is ignored.
     */
    private boolean enabled = true;

    /**
     * Feature flags for optional pipeline stages.
     */
    private Features features = new Features();

    /**
     * Constants of the adaptive throttling strategy.
     */
    private Adaptive adaptive = new Adaptive();

    /**
     * Escalation settings.
     */
    private Escalation escalation = new Escalation();

    /**
     * Metric derivation settings.
     */
    private Metrics metrics = new Metrics();

    @Getter
    @Setter
    public static class Features {

        /**
         * Dispatch notifications for admitted alerts.
         */
        private boolean notificationsEnabled = true;

        /**
         * Forward admitted alerts to the security event sink.
         */
        private boolean securityForwardingEnabled = true;

        /**
         * Escalate high-severity alerts right after admission.
         */
        private boolean immediateEscalationEnabled = true;
    }

    @Getter
    @Setter
    public static class Adaptive {

        /**
         * False-positive rate above which alerts may be suppressed.
         */
        private double falsePositiveThreshold = 0.3;

        /**
         * Probability of suppressing when the false-positive rate is high.
         */
        private double falsePositiveSuppressProbability = 0.7;

        /**
         * User engagement below which alerts may be suppressed.
         */
        private double engagementThreshold = 0.2;

        /**
         * Probability of suppressing when engagement is low.
         */
        private double lowEngagementSuppressProbability = 0.5;

        /**
         * Step applied by the periodic decay job.
         */
        private double decayStep = 0.01;
    }

    @Getter
    @Setter
    public static class Escalation {

        /**
         * Severity at or above which a new alert is escalated immediately.
         */
        private int immediateSeverity = 9;
    }

    @Getter
    @Setter
    public static class Metrics {

        /**
         * Estimated cost saved per throttled or deduplicated alert.
         */
        private double costPerSuppressedAlert = 5.0;

        /**
         * Cap of the alert fatigue score.
         */
        private int fatigueCap = 100;
    }
}
