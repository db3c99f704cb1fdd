package com.slapulse.calendar;

import com.slapulse.config.BusinessHours;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Counts working minutes between two instants.
 *
 * Only minutes inside the daily business window on working days count. Each
 * day contributes whole minutes of its clipped window.
 */
public class BusinessDurationCalculator {

    private final BusinessCalendar calendar;
    private final BusinessHours hours;
    private final ZoneId zone;

    public BusinessDurationCalculator(BusinessCalendar calendar, BusinessHours hours) {
        this.calendar = Objects.requireNonNull(calendar, "calendar must not be null");
        this.hours = Objects.requireNonNull(hours, "hours must not be null");
        this.zone = hours.zone();
    }

    /**
     * Business minutes from start to end.
     *
     * @return minutes, 0 or more, or null when either instant is missing or end precedes start
     */
    public Long businessMinutesBetween(Instant start, Instant end) {
        if (start == null || end == null || end.isBefore(start)) {
            return null;
        }

        ZonedDateTime zonedStart = start.atZone(zone);
        ZonedDateTime zonedEnd = end.atZone(zone);
        LocalDate firstDay = zonedStart.toLocalDate();
        LocalDate lastDay = zonedEnd.toLocalDate();

        long totalMinutes = 0;
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            if (!calendar.isWorkingDay(day)) {
                continue;
            }
            ZonedDateTime windowStart = day.atTime(hours.start()).atZone(zone);
            ZonedDateTime windowEnd = day.atTime(hours.end()).atZone(zone);

            ZonedDateTime effectiveStart = day.equals(firstDay) && zonedStart.isAfter(windowStart)
                ? zonedStart : windowStart;
            ZonedDateTime effectiveEnd = day.equals(lastDay) && zonedEnd.isBefore(windowEnd)
                ? zonedEnd : windowEnd;

            if (effectiveEnd.isAfter(effectiveStart)) {
                totalMinutes += Duration.between(effectiveStart, effectiveEnd).toMinutes();
            }
        }
        return totalMinutes;
    }
}
