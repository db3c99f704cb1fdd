package com.slapulse.util;

import com.slapulse.model.DurationValue;

/**
 * Renders business-minute values for display.
 */
public final class DurationFormatter {

    public static final String PENDING = "Pending";

    private DurationFormatter() {
    }

    /**
     * Formats minutes as "45m", "3h" or "3h 15m".
     */
    public static String formatMinutes(long minutes) {
        long hours = minutes / 60;
        long remainingMinutes = minutes % 60;
        if (hours == 0) {
            return remainingMinutes + "m";
        }
        if (remainingMinutes == 0) {
            return hours + "h";
        }
        return hours + "h " + remainingMinutes + "m";
    }

    public static String format(DurationValue value) {
        if (value instanceof DurationValue.Known known) {
            return formatMinutes(known.value());
        }
        if (value instanceof DurationValue.PendingWithHistory history) {
            return PENDING + " (prev " + formatMinutes(history.previousMinutes()) + ")";
        }
        return PENDING;
    }
}
