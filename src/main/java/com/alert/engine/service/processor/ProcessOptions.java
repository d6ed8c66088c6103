package com.alert.engine.service.processor;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call options of {@link AlertProcessor#process}.
 */
@Value
@Builder
public class ProcessOptions {

    private static final ProcessOptions DEFAULTS = ProcessOptions.builder().build();

    String sourceSystem;
    String sourceId;
    String storeId;

    /**
     * Process even outside the definition's active hours.
     */
    boolean forceProcess;

    /**
     * Skip deduplication and throttling and admit directly.
     */
    boolean bypassThrottling;

    public static ProcessOptions defaults() {
        return DEFAULTS;
    }
}
