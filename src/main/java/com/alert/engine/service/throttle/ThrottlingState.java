package com.alert.engine.service.throttle;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutable throttling bookkeeping of one alert definition.
 *
 * Every read-modify-write happens while holding {@link #lock()}. The lock is reentrant so
 * escalations triggered from inside a throttling decision can record themselves.
 */
@Getter
public class ThrottlingState {

    private final String definitionId;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();

    private Instant windowStart;
    private int countInWindow;
    private Instant lastEventTime;
    private int escalationCount;
    private Instant lastEscalationTime;
    private volatile Instant lastActivity;
    private boolean retired;

    private final Map<String, FingerprintRecord> recentFingerprints = new LinkedHashMap<>();
    private final AdaptiveMetrics adaptiveMetrics = new AdaptiveMetrics();

    public ThrottlingState(String definitionId, Instant now) {
        this.definitionId = definitionId;
        this.createdAt = now;
        this.windowStart = now;
        this.lastActivity = now;
    }

    public ReentrantLock lock() {
        return lock;
    }

    /**
     * Runs the action while holding this state's lock.
     */
    public <T> T computeLocked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Window ====================

    void resetWindowIfElapsed(Instant now, Duration window) {
        if (!now.isBefore(windowStart.plus(window))) {
            windowStart = now;
            countInWindow = 0;
        }
    }

    void recordWindowAdmission(Instant now) {
        countInWindow++;
        lastEventTime = now;
    }

    void recordCooldownAdmission(Instant now) {
        lastEventTime = now;
    }

    // ==================== Escalation ====================

    void recordEscalation(Instant now) {
        escalationCount++;
        lastEscalationTime = now;
    }

    // ==================== Activity ====================

    void touch(Instant now) {
        lastActivity = now;
    }

    public boolean isIdleSince(Instant cutoff) {
        return lastActivity.isBefore(cutoff);
    }

    /**
     * Marks the state as removed from its store. Callers must hold the lock.
     */
    void retire() {
        retired = true;
    }
}
