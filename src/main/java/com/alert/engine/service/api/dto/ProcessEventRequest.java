package com.alert.engine.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO for submitting an operational event to the alert pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessEventRequest {

    /**
     * Event type, e.g. {@code low_stock} or {@code security_incident}.
     */
    @NotBlank(message = "eventType is required")
    private String eventType;

    /**
     * Event payload the trigger conditions are evaluated against.
     */
    @NotNull(message = "data is required")
    private Map<String, Object> data;

    private String sourceSystem;

    private String sourceId;

    private String storeId;

    /**
     * Process even outside the definition's active hours.
     */
    @Builder.Default
    private boolean forceProcess = false;

    /**
     * Skip deduplication and throttling.
     */
    @Builder.Default
    private boolean bypassThrottling = false;
}
