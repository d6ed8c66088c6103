package com.alert.engine.service.throttle;

/**
 * Outcome of throttling a candidate alert.
 */
public sealed interface ThrottlingDecision
        permits ThrottlingDecision.Admit, ThrottlingDecision.Suppress, ThrottlingDecision.Deduplicate {

    enum Outcome { ADMIT, SUPPRESS, DEDUPLICATE }

    Outcome outcome();

    static ThrottlingDecision admit() {
        return Admit.INSTANCE;
    }

    static ThrottlingDecision suppress(String reason) {
        return new Suppress(reason);
    }

    static ThrottlingDecision deduplicate(String existingAlertId) {
        return new Deduplicate(existingAlertId);
    }

    record Admit() implements ThrottlingDecision {
        private static final Admit INSTANCE = new Admit();

        @Override
        public Outcome outcome() {
            return Outcome.ADMIT;
        }
    }

    record Suppress(String reason) implements ThrottlingDecision {
        public static final String TIME_WINDOW_LIMIT = "time_window_limit_exceeded";
        public static final String COOLDOWN_ACTIVE = "cooldown_period_active";
        public static final String SIMILAR_ALERT = "similar_alert_detected";
        public static final String ESCALATED_EXISTING = "escalated_existing_alert";
        public static final String ADAPTIVE_FALSE_POSITIVES = "adaptive_high_false_positive_rate";
        public static final String ADAPTIVE_LOW_ENGAGEMENT = "adaptive_low_user_engagement";

        @Override
        public Outcome outcome() {
            return Outcome.SUPPRESS;
        }
    }

    record Deduplicate(String existingAlertId) implements ThrottlingDecision {
        @Override
        public Outcome outcome() {
            return Outcome.DEDUPLICATE;
        }
    }
}
