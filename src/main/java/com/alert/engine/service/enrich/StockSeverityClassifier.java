package com.alert.engine.service.enrich;

import com.alert.engine.service.config.InventoryConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Classifies a stock level against the configured inventory thresholds.
 *
 * Ordering: empty or at most {@code criticalStock} is CRITICAL, at most {@code lowStock} is HIGH,
 * at most {@code reorderPoint} is MEDIUM, at or above {@code maxStock} (overstock) is MEDIUM,
 * anything else is LOW.
 */
@Component
@RequiredArgsConstructor
public class StockSeverityClassifier {

    private final InventoryConfig inventoryConfig;

    public StockSeverity classify(long quantity) {
        if (quantity <= 0 || quantity <= inventoryConfig.getCriticalStock()) {
            return StockSeverity.CRITICAL;
        }
        if (quantity <= inventoryConfig.getLowStock()) {
            return StockSeverity.HIGH;
        }
        if (quantity <= inventoryConfig.getReorderPoint()) {
            return StockSeverity.MEDIUM;
        }
        if (inventoryConfig.getMaxStock() > 0 && quantity >= inventoryConfig.getMaxStock()) {
            return StockSeverity.MEDIUM;
        }
        return StockSeverity.LOW;
    }
}
