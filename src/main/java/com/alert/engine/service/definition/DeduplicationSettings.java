package com.alert.engine.service.definition;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Which event fields form the fingerprint and how long a live alert absorbs duplicates.
 */
@Value
@Builder(toBuilder = true)
public class DeduplicationSettings {

    @Builder.Default
    boolean enabled = true;

    @Singular
    List<String> fields;

    @Builder.Default
    Duration window = Duration.ofHours(1);

    public static DeduplicationSettings disabled() {
        return DeduplicationSettings.builder().enabled(false).build();
    }
}
