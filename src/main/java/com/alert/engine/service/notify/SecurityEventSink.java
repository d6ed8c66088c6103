package com.alert.engine.service.notify;

/**
 * Best-effort forwarding of alert audit records to a SIEM.
 */
public interface SecurityEventSink {

    void record(SecurityEvent event);
}
