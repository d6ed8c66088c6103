package com.alert.engine.service.definition;

/**
 * Priority assigned to alerts produced by a definition, lowest first.
 */
public enum AlertPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL,
    EMERGENCY;

    public boolean isCriticalOrAbove() {
        return this == CRITICAL || this == EMERGENCY;
    }
}
