package com.alert.engine.service.alert;

import lombok.Getter;

/**
 * Raised when an operation is not allowed from the alert's current status.
 */
@Getter
public class IllegalAlertTransitionException extends AlertProcessingException {

    private final AlertStatus currentStatus;

    public IllegalAlertTransitionException(String alertId, AlertStatus currentStatus, String operation) {
        super("Cannot " + operation + " alert " + alertId + " in status " + currentStatus,
                alertId, ILLEGAL_TRANSITION);
        this.currentStatus = currentStatus;
    }
}
