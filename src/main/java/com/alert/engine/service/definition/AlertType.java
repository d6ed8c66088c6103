package com.alert.engine.service.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Operational event types that alert definitions can be registered for.
 */
public enum AlertType {

    LOW_STOCK("low_stock"),
    OUT_OF_STOCK("out_of_stock"),
    PRICE_CHANGE("price_change"),
    INVENTORY_DISCREPANCY("inventory_discrepancy"),
    SYSTEM_ERROR("system_error"),
    SECURITY_INCIDENT("security_incident"),
    PAYMENT_FAILURE("payment_failure"),
    ORDER_ANOMALY("order_anomaly"),
    USER_ACTIVITY_SUSPICIOUS("user_activity_suspicious");

    private final String value;

    AlertType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves an event type from its wire value ({@code low_stock}) or constant name ({@code LOW_STOCK}).
     *
     * @throws IllegalArgumentException if the value names no known event type
     */
    @JsonCreator
    public static AlertType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + raw));
    }
}
