package com.alert.engine.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of processing an event. {@code alertId} is null when no alert resulted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessEventResponse {

    private String eventType;

    private String alertId;

    private boolean alertCreated;
}
