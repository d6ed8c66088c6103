package com.alert.engine.service.definition;

/**
 * Throttling strategy a definition is configured with.
 */
public enum ThrottlingStrategyType {
    TIME_BASED,
    COUNT_BASED,
    SIMILARITY_BASED,
    ESCALATION_BASED,
    ADAPTIVE
}
