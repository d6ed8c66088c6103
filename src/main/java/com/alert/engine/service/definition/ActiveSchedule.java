package com.alert.engine.service.definition;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Set;

/**
 * Hours and days during which a definition produces alerts.
 *
 * Days use 0 = Sunday through 6 = Saturday. A window whose start is after its end wraps past midnight.
 */
@Value
@Builder(toBuilder = true)
public class ActiveSchedule {

    private static final Set<Integer> ALL_DAYS = Set.of(0, 1, 2, 3, 4, 5, 6);

    @Builder.Default
    LocalTime start = LocalTime.MIDNIGHT;

    @Builder.Default
    LocalTime end = LocalTime.of(23, 59);

    @Builder.Default
    Set<Integer> activeDays = ALL_DAYS;

    @Builder.Default
    ZoneId timezone = ZoneId.of("UTC");

    public static ActiveSchedule always() {
        return ActiveSchedule.builder().build();
    }

    public boolean isActiveAt(Instant instant) {
        ZonedDateTime local = instant.atZone(timezone);
        if (!activeDays.contains(dayIndex(local.getDayOfWeek()))) {
            return false;
        }
        LocalTime time = local.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        if (!start.isAfter(end)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        return !time.isBefore(start) || !time.isAfter(end);
    }

    private static int dayIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }
}
