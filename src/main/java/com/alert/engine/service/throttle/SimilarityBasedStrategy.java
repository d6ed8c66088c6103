package com.alert.engine.service.throttle;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.ThrottlingConfig;
import com.alert.engine.service.definition.ThrottlingStrategyType;
import com.alert.engine.service.fingerprint.SimilarityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Suppresses alerts whose fingerprint is close to one seen within the time window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimilarityBasedStrategy implements ThrottlingStrategy {

    private final SimilarityScorer similarityScorer;

    @Override
    public ThrottlingStrategyType type() {
        return ThrottlingStrategyType.SIMILARITY_BASED;
    }

    @Override
    public ThrottlingDecision decide(Alert candidate, AlertDefinition definition, ThrottlingState state, Instant now) {
        ThrottlingConfig config = definition.getThrottlingConfig();
        Map<String, FingerprintRecord> recent = state.getRecentFingerprints();

        Instant horizon = now.minus(config.getTimeWindow());
        recent.values().removeIf(record -> record.getLastSeen().isBefore(horizon));

        for (Map.Entry<String, FingerprintRecord> entry : recent.entrySet()) {
            double score = similarityScorer.similarity(candidate.getFingerprint(), entry.getKey());
            if (score >= config.getSimilarityThreshold()) {
                entry.getValue().hit(now);
                log.debug("Similar fingerprint for {}: {} ~ {} ({})", definition.getId(),
                        candidate.getFingerprint(), entry.getKey(), score);
                return ThrottlingDecision.suppress(ThrottlingDecision.Suppress.SIMILAR_ALERT);
            }
        }
        recent.put(candidate.getFingerprint(), new FingerprintRecord(now, candidate.getId()));
        return ThrottlingDecision.admit();
    }
}
