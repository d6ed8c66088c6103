package com.alert.engine.service.api.controller;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AlertLifecycleManager;
import com.alert.engine.service.alert.AlertNotFoundException;
import com.alert.engine.service.api.dto.AlertActionRequest;
import com.alert.engine.service.api.dto.AlertResponse;
import com.alert.engine.service.api.dto.ApiResponse;
import com.alert.engine.service.api.dto.ProcessEventRequest;
import com.alert.engine.service.api.dto.ProcessEventResponse;
import com.alert.engine.service.api.dto.SystemStateRequest;
import com.alert.engine.service.definition.AlertType;
import com.alert.engine.service.metrics.AlertMetrics;
import com.alert.engine.service.metrics.HealthReport;
import com.alert.engine.service.processor.AlertProcessor;
import com.alert.engine.service.processor.ProcessOptions;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Controller for event processing and alert lifecycle actions.
 */
@Slf4j
@RestController
@RequestMapping("/alerts")
@Tag(name = "Alerts", description = "Event processing, alert lifecycle and engine statistics")
@RequiredArgsConstructor
public class AlertController {

    private final AlertProcessor alertProcessor;
    private final AlertLifecycleManager lifecycleManager;

    @PostMapping("/events")
    @Operation(
            summary = "Process an event",
            description = "Runs the event through trigger evaluation, deduplication and throttling. " +
                    "Returns the new or merged alert id, or null when no alert resulted."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Event processed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request or unknown event type")
    })
    public ResponseEntity<ApiResponse<ProcessEventResponse>> processEvent(
            @Valid @RequestBody ProcessEventRequest request) {

        AlertType eventType = AlertType.fromValue(request.getEventType());
        log.debug("Processing {} event from {}", eventType.getValue(), request.getSourceSystem());

        Optional<String> alertId = alertProcessor.process(eventType, request.getData(), ProcessOptions.builder()
                .sourceSystem(request.getSourceSystem())
                .sourceId(request.getSourceId())
                .storeId(request.getStoreId())
                .forceProcess(request.isForceProcess())
                .bypassThrottling(request.isBypassThrottling())
                .build());

        return ResponseEntity.ok(ApiResponse.success(ProcessEventResponse.builder()
                .eventType(eventType.getValue())
                .alertId(alertId.orElse(null))
                .alertCreated(alertId.isPresent())
                .build()));
    }

    @GetMapping("/{alertId}")
    @Operation(summary = "Get alert details", description = "Returns the alert with its escalation history and audit trail")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Alert found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Alert not found")
    })
    public ResponseEntity<ApiResponse<AlertResponse>> getAlert(
            @Parameter(description = "Alert ID") @PathVariable String alertId) {
        Alert alert = alertProcessor.findAlert(alertId)
                .orElseThrow(() -> new AlertNotFoundException(alertId));
        return ResponseEntity.ok(ApiResponse.success(toResponse(alert)));
    }

    @PostMapping("/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an alert")
    public ResponseEntity<ApiResponse<AlertResponse>> acknowledge(
            @Parameter(description = "Alert ID") @PathVariable String alertId,
            @Valid @RequestBody AlertActionRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                toResponse(lifecycleManager.acknowledge(alertId, request.getActor()))));
    }

    @PostMapping("/{alertId}/resolve")
    @Operation(summary = "Resolve an alert", description = "Use reason 'false_positive' to report a false positive")
    public ResponseEntity<ApiResponse<AlertResponse>> resolve(
            @Parameter(description = "Alert ID") @PathVariable String alertId,
            @Valid @RequestBody AlertActionRequest request) {
        String resolution = request.getReason() == null ? "resolved" : request.getReason();
        return ResponseEntity.ok(ApiResponse.success(
                toResponse(lifecycleManager.resolve(alertId, resolution, request.getActor()))));
    }

    @PostMapping("/{alertId}/suppress")
    @Operation(summary = "Suppress an alert", description = "Only allowed for definitions with suppression enabled")
    public ResponseEntity<ApiResponse<AlertResponse>> suppress(
            @Parameter(description = "Alert ID") @PathVariable String alertId,
            @Valid @RequestBody AlertActionRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                toResponse(lifecycleManager.suppress(alertId, request.getActor(), request.getReason()))));
    }

    @PostMapping("/{alertId}/escalate")
    @Operation(summary = "Escalate an alert")
    public ResponseEntity<ApiResponse<AlertResponse>> escalate(
            @Parameter(description = "Alert ID") @PathVariable String alertId,
            @Valid @RequestBody AlertActionRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                toResponse(lifecycleManager.escalate(alertId, request.getReason(), request.getActor()))));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get engine statistics")
    public ResponseEntity<ApiResponse<AlertMetrics>> getStats() {
        return ResponseEntity.ok(ApiResponse.success(alertProcessor.getStats()));
    }

    @GetMapping("/health")
    @Operation(summary = "Get engine health", description = "Status is healthy, warning, degraded or critical")
    public ResponseEntity<ApiResponse<HealthReport>> getHealth() {
        return ResponseEntity.ok(ApiResponse.success(alertProcessor.healthCheck()));
    }

    @PostMapping("/system-state")
    @Operation(summary = "Record system state", description = "Feeds auto-resolve conditions for an alert subject")
    public ResponseEntity<ApiResponse<Map<String, String>>> recordSystemState(
            @Valid @RequestBody SystemStateRequest request) {
        String fingerprint = request.getFingerprint();
        if (fingerprint == null || fingerprint.isBlank()) {
            if (request.getEventData() == null) {
                throw new IllegalArgumentException("fingerprint or eventData is required");
            }
            fingerprint = alertProcessor.fingerprintFor(request.getDefinitionId(), request.getEventData());
        }
        alertProcessor.recordSystemState(request.getDefinitionId(), fingerprint, request.getState());
        return ResponseEntity.ok(ApiResponse.success(Map.of(
                "definitionId", request.getDefinitionId(),
                "fingerprint", fingerprint)));
    }

    // --- Private helpers ---

    private AlertResponse toResponse(Alert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .definitionId(alert.getDefinitionId())
                .type(alert.getType().getValue())
                .title(alert.getTitle())
                .message(alert.getMessage())
                .status(alert.getStatus().name())
                .priority(alert.getPriority().name())
                .severity(alert.getSeverity())
                .fingerprint(alert.getFingerprint())
                .sourceSystem(alert.getSourceSystem())
                .sourceId(alert.getSourceId())
                .storeId(alert.getStoreId())
                .triggeredAt(alert.getTriggeredAt())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .acknowledgedBy(alert.getAcknowledgedBy())
                .resolvedAt(alert.getResolvedAt())
                .resolvedBy(alert.getResolvedBy())
                .resolution(alert.getResolution())
                .escalatedAt(alert.getEscalatedAt())
                .escalationLevel(alert.getEscalationLevel())
                .originalCount(alert.getOriginalCount())
                .relatedAlerts(alert.getRelatedAlerts())
                .notificationChannels(alert.getNotificationChannels())
                .throttled(alert.isThrottled())
                .throttleReason(alert.getThrottleReason())
                .businessImpact(alert.getBusinessImpact())
                .affectedUsers(alert.getAffectedUsers())
                .affectedOrders(alert.getAffectedOrders())
                .estimatedRevenueLoss(alert.getEstimatedRevenueLoss())
                .securityRelevant(alert.isSecurityRelevant())
                .threatLevel(alert.getThreatLevel())
                .details(alert.getDetails())
                .escalationHistory(alert.getEscalationHistory().stream()
                        .map(record -> AlertResponse.EscalationResponse.builder()
                                .level(record.level())
                                .escalatedAt(record.escalatedAt())
                                .escalatedTo(record.escalatedTo())
                                .reason(record.reason())
                                .build())
                        .toList())
                .auditTrail(alert.getAuditTrail().stream()
                        .map(entry -> AlertResponse.AuditResponse.builder()
                                .timestamp(entry.timestamp())
                                .action(entry.action())
                                .actor(entry.actor())
                                .details(entry.details())
                                .build())
                        .toList())
                .build();
    }
}
