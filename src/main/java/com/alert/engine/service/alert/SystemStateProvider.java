package com.alert.engine.service.alert;

import java.util.Map;

/**
 * Supplies the current system state that auto-resolve conditions are evaluated against.
 */
public interface SystemStateProvider {

    /**
     * Current state for the subject of the alert; empty when nothing is known.
     */
    Map<String, Object> currentState(Alert alert);
}
