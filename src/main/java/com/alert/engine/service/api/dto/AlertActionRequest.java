package com.alert.engine.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator action on an alert: acknowledge, resolve, suppress or escalate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertActionRequest {

    @NotBlank(message = "actor is required")
    private String actor;

    /**
     * Resolution for resolve, reason for suppress and escalate. Ignored by acknowledge.
     */
    private String reason;
}
