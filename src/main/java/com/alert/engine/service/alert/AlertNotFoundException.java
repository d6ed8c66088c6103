package com.alert.engine.service.alert;

public class AlertNotFoundException extends AlertProcessingException {

    public AlertNotFoundException(String alertId) {
        super("Alert not found: " + alertId, alertId, ALERT_NOT_FOUND);
    }
}
