package com.slapulse.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classifies calendar dates as working or non-working in one fixed timezone.
 *
 * Holiday sets are computed once per year and shared. Two threads racing on
 * the same year compute equal sets and the first one stored wins.
 */
public class BusinessCalendar {

    private static final Logger log = LoggerFactory.getLogger(BusinessCalendar.class);

    private final ZoneId zone;

    private final Map<Integer, Set<LocalDate>> holidayCache = new ConcurrentHashMap<>();

    public BusinessCalendar(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId getZone() {
        return zone;
    }

    public boolean isWorkingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        return !isHoliday(date);
    }

    public boolean isWorkingDay(Instant instant) {
        return isWorkingDay(instant.atZone(zone).toLocalDate());
    }

    public boolean isHoliday(LocalDate date) {
        if (holidaySet(date.getYear()).contains(date)) {
            return true;
        }
        // New Year's Day on a Saturday is observed on the last day of the prior year
        return date.getMonth() == Month.DECEMBER && date.getDayOfMonth() == 31
            && holidaySet(date.getYear() + 1).contains(date);
    }

    /**
     * Observed holidays for a year, computed on first use.
     */
    public Set<LocalDate> holidaySet(int year) {
        Set<LocalDate> cached = holidayCache.get(year);
        if (cached != null) {
            return cached;
        }
        Set<LocalDate> computed = Collections.unmodifiableSet(HolidayRules.observedHolidays(year));
        Set<LocalDate> existing = holidayCache.putIfAbsent(year, computed);
        if (existing != null) {
            return existing;
        }
        log.debug("Computed {} observed holidays for {}", computed.size(), year);
        return computed;
    }
}
