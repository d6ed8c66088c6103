package com.alert.engine.service.alert;

public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    SUPPRESSED,
    ESCALATED;

    public boolean isTerminal() {
        return this == RESOLVED;
    }
}
