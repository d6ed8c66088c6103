package com.alert.engine.service.throttle;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.ThrottlingStrategyType;

import java.time.Instant;

/**
 * One throttling algorithm. Called with the state's lock held.
 */
public interface ThrottlingStrategy {

    ThrottlingStrategyType type();

    ThrottlingDecision decide(Alert candidate, AlertDefinition definition, ThrottlingState state, Instant now);
}
