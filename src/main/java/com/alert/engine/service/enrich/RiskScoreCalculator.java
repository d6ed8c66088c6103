package com.alert.engine.service.enrich;

import com.alert.engine.service.alert.Alert;
import org.springframework.stereotype.Component;

/**
 * Scores an alert from 0 to 100 for security event forwarding.
 */
@Component
public class RiskScoreCalculator {

    public int score(Alert alert) {
        int score = switch (alert.getPriority()) {
            case EMERGENCY -> 50;
            case CRITICAL -> 40;
            case HIGH -> 30;
            case NORMAL -> 20;
            case LOW -> 10;
        };
        if (alert.isSecurityRelevant()) {
            score += 25;
        }
        if (AlertFactory.THREAT_CRITICAL.equals(alert.getThreatLevel())) {
            score += 20;
        }
        if (alert.getEstimatedRevenueLoss() > 1000) {
            score += 15;
        }
        if (alert.getAffectedUsers() > 100) {
            score += 10;
        }
        return Math.max(0, Math.min(100, score));
    }
}
