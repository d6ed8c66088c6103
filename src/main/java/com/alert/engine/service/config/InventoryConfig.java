package com.alert.engine.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Stock thresholds used to classify low-stock and out-of-stock alerts.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "alert.inventory")
public class InventoryConfig {

    private int criticalStock = 5;

    private int lowStock = 25;

    private int reorderPoint = 50;

    /**
     * Upper bound above which stock counts as overstock. Zero disables the check.
     */
    private int maxStock = 5000;

    private int safetyStock = 20;
}
