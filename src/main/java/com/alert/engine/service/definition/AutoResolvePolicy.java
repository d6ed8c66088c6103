package com.alert.engine.service.definition;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * When an active alert resolves itself: after a timeout, or early once the conditions hold.
 */
@Value
@Builder(toBuilder = true)
public class AutoResolvePolicy {

    boolean enabled;

    @Singular
    List<TriggerCondition> conditions;

    /**
     * Zero disables the timeout path.
     */
    @Builder.Default
    Duration timeout = Duration.ZERO;

    public static AutoResolvePolicy disabled() {
        return AutoResolvePolicy.builder().enabled(false).build();
    }

    public boolean hasTimeout() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }
}
