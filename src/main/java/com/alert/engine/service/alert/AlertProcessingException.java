package com.alert.engine.service.alert;

import lombok.Getter;

/**
 * Exception thrown when an event cannot be processed or an alert operation fails.
 */
@Getter
public class AlertProcessingException extends RuntimeException {

    public static final String FINGERPRINT_FAILED = "FINGERPRINT_FAILED";
    public static final String THROTTLING_FAILED = "THROTTLING_FAILED";
    public static final String PERSISTENCE_FAILED = "PERSISTENCE_FAILED";
    public static final String ALERT_NOT_FOUND = "ALERT_NOT_FOUND";
    public static final String ILLEGAL_TRANSITION = "ILLEGAL_TRANSITION";

    /**
     * Definition or alert the failure relates to.
     */
    private final String entityId;

    private final String errorCode;

    public AlertProcessingException(String message) {
        super(message);
        this.entityId = null;
        this.errorCode = "PROCESSING_ERROR";
    }

    public AlertProcessingException(String message, String entityId, String errorCode) {
        super(message);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public AlertProcessingException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }
}
