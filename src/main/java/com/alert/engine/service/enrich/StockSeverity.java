package com.alert.engine.service.enrich;

public enum StockSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
