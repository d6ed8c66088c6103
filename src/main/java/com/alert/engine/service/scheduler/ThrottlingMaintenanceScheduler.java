package com.alert.engine.service.scheduler;

import com.alert.engine.service.alert.AlertLifecycleManager;
import com.alert.engine.service.alert.DeduplicationIndex;
import com.alert.engine.service.config.AlertEngineConfig;
import com.alert.engine.service.config.SchedulerConfig;
import com.alert.engine.service.throttle.ThrottlingStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Background jobs: idle state cleanup, the auto-resolution sweep and adaptive metric decay.
 *
 * Each job iterates a snapshot and is safe to run alongside event processing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThrottlingMaintenanceScheduler {

    private final ThrottlingStateStore stateStore;
    private final DeduplicationIndex deduplicationIndex;
    private final AlertLifecycleManager lifecycleManager;
    private final SchedulerConfig schedulerConfig;
    private final AlertEngineConfig engineConfig;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${alert.scheduler.cleanup-interval-ms:3600000}",
            initialDelayString = "${alert.scheduler.cleanup-interval-ms:3600000}")
    public int cleanupIdleState() {
        Instant cutoff = clock.instant().minus(schedulerConfig.getStateTtl());
        int states = stateStore.pruneIdle(cutoff);
        int entries = deduplicationIndex.prune(cutoff);
        log.debug("State cleanup removed {} throttling states and {} index entries", states, entries);
        return states;
    }

    @Scheduled(fixedDelayString = "${alert.scheduler.auto-resolve-interval-ms:300000}",
            initialDelayString = "${alert.scheduler.auto-resolve-interval-ms:300000}")
    public int autoResolve() {
        return lifecycleManager.runAutoResolution(clock.instant());
    }

    @Scheduled(fixedDelayString = "${alert.scheduler.adaptive-decay-interval-ms:900000}",
            initialDelayString = "${alert.scheduler.adaptive-decay-interval-ms:900000}")
    public void decayAdaptiveMetrics() {
        stateStore.decayAdaptiveMetrics(engineConfig.getAdaptive().getDecayStep());
        log.debug("Adaptive metrics decayed for {} throttling states", stateStore.size());
    }
}
