package com.alert.engine.service.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes security events as JSON to the {@code SECURITY_AUDIT} logger.
 */
@Component
@RequiredArgsConstructor
public class LoggingSecurityEventSink implements SecurityEventSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("SECURITY_AUDIT");

    private final ObjectMapper objectMapper;

    @Override
    public void record(SecurityEvent event) {
        try {
            AUDIT.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize security event for alert " + event.getAlertId(), e);
        }
    }
}
