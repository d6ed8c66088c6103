package com.alert.engine.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Current system state for the subject of an alert, used by auto-resolve conditions.
 *
 * The subject is identified by {@code fingerprint}, or by {@code eventData} from which the
 * fingerprint is derived.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStateRequest {

    @NotBlank(message = "definitionId is required")
    private String definitionId;

    private String fingerprint;

    private Map<String, Object> eventData;

    @NotEmpty(message = "state cannot be empty")
    private Map<String, Object> state;
}
