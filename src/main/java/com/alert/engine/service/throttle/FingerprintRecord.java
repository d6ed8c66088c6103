package com.alert.engine.service.throttle;

import lombok.Getter;

import java.time.Instant;

/**
 * Recently seen fingerprint tracked by the similarity strategy.
 */
@Getter
public class FingerprintRecord {

    private int count;
    private final Instant firstSeen;
    private Instant lastSeen;
    private final String representativeAlertId;

    FingerprintRecord(Instant seenAt, String representativeAlertId) {
        this.count = 1;
        this.firstSeen = seenAt;
        this.lastSeen = seenAt;
        this.representativeAlertId = representativeAlertId;
    }

    void hit(Instant now) {
        count++;
        lastSeen = now;
    }
}
