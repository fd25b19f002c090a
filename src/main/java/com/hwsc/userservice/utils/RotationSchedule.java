package com.hwsc.userservice.utils;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Weekly secret rotation boundary: every Monday at 03:00 UTC.
 */
public final class RotationSchedule {

    public static final DayOfWeek ROTATION_DAY = DayOfWeek.MONDAY;
    public static final LocalTime ROTATION_TIME = LocalTime.of(3, 0);

    private RotationSchedule() {}

    /** The first rotation boundary strictly after {@code from}. */
    public static Instant nextExpiration(Instant from) {
        ZonedDateTime utc = from.atZone(ZoneOffset.UTC);
        ZonedDateTime candidate = utc
                .with(TemporalAdjusters.nextOrSame(ROTATION_DAY))
                .with(ROTATION_TIME);
        if (!candidate.isAfter(utc)) {
            candidate = candidate.plusWeeks(1);
        }
        return candidate.toInstant();
    }
}
