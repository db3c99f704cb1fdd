package com.slapulse.config;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * The fixed daily working window [start, end) in one timezone.
 */
public record BusinessHours(ZoneId zone, LocalTime start, LocalTime end) {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Denver");

    public BusinessHours {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("business hours end " + end + " must be after start " + start);
        }
    }

    public static BusinessHours defaults() {
        return new BusinessHours(DEFAULT_ZONE, LocalTime.of(8, 0), LocalTime.of(17, 0));
    }
}
