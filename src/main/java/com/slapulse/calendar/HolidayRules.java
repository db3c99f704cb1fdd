package com.slapulse.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Date arithmetic for the observed US federal holiday set.
 */
public final class HolidayRules {

    private HolidayRules() {
    }

    /**
     * The nth occurrence of a weekday in a month, n starting at 1.
     */
    public static LocalDate nthWeekdayOfMonth(int year, Month month, DayOfWeek weekday, int nth) {
        if (nth < 1 || nth > 5) {
            throw new IllegalArgumentException("nth must be between 1 and 5, was " + nth);
        }
        LocalDate firstOfMonth = LocalDate.of(year, month, 1);
        int offset = (7 + weekday.getValue() - firstOfMonth.getDayOfWeek().getValue()) % 7;
        return firstOfMonth.plusDays(offset + (nth - 1) * 7L);
    }

    public static LocalDate lastWeekdayOfMonth(int year, Month month, DayOfWeek weekday) {
        LocalDate lastOfMonth = YearMonth.of(year, month).atEndOfMonth();
        int offset = (7 + lastOfMonth.getDayOfWeek().getValue() - weekday.getValue()) % 7;
        return lastOfMonth.minusDays(offset);
    }

    /**
     * Saturday holidays move to Friday, Sunday holidays to Monday.
     */
    public static LocalDate observed(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY) {
            return date.minusDays(1);
        }
        if (day == DayOfWeek.SUNDAY) {
            return date.plusDays(1);
        }
        return date;
    }

    /**
     * Observed dates of the holidays of one year, in calendar order.
     *
     * The first element can fall on December 31 of the previous year when
     * New Year's Day is a Saturday.
     */
    public static Set<LocalDate> observedHolidays(int year) {
        Set<LocalDate> holidays = new LinkedHashSet<>();
        holidays.add(observed(LocalDate.of(year, Month.JANUARY, 1)));
        holidays.add(nthWeekdayOfMonth(year, Month.JANUARY, DayOfWeek.MONDAY, 3));
        holidays.add(nthWeekdayOfMonth(year, Month.FEBRUARY, DayOfWeek.MONDAY, 3));
        holidays.add(lastWeekdayOfMonth(year, Month.MAY, DayOfWeek.MONDAY));
        holidays.add(observed(LocalDate.of(year, Month.JUNE, 19)));
        holidays.add(observed(LocalDate.of(year, Month.JULY, 4)));
        holidays.add(nthWeekdayOfMonth(year, Month.SEPTEMBER, DayOfWeek.MONDAY, 1));
        holidays.add(nthWeekdayOfMonth(year, Month.OCTOBER, DayOfWeek.MONDAY, 2));
        holidays.add(observed(LocalDate.of(year, Month.NOVEMBER, 11)));
        holidays.add(nthWeekdayOfMonth(year, Month.NOVEMBER, DayOfWeek.THURSDAY, 4));
        holidays.add(observed(LocalDate.of(year, Month.DECEMBER, 25)));
        return holidays;
    }
}
