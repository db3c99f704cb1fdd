package com.slapulse.unit;

import com.slapulse.model.DurationValue;
import com.slapulse.util.DurationFormatter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DurationFormatterTest {

    @Test
    void test_minutes_only() {
        assertEquals("0m", DurationFormatter.formatMinutes(0));
        assertEquals("45m", DurationFormatter.formatMinutes(45));
    }

    @Test
    void test_whole_hours_drop_minutes() {
        assertEquals("2h", DurationFormatter.formatMinutes(120));
        assertEquals("50h", DurationFormatter.formatMinutes(3000));
    }

    @Test
    void test_hours_and_minutes() {
        assertEquals("3h 15m", DurationFormatter.formatMinutes(195));
        assertEquals("1h 1m", DurationFormatter.formatMinutes(61));
    }

    @Test
    void test_duration_values() {
        assertEquals("6h 15m", DurationFormatter.format(DurationValue.of(375L, null)));
        assertEquals("Pending (prev 25h)", DurationFormatter.format(DurationValue.of(null, 1500L)));
        assertEquals("Pending", DurationFormatter.format(DurationValue.of(null, null)));
    }

    @Test
    void test_negative_values_are_treated_as_absent() {
        DurationValue value = DurationValue.of(-5L, -1L);
        assertTrue(value.isPending());
        assertNull(value.minutes());
        assertEquals("Pending", DurationFormatter.format(value));
        assertThrows(IllegalArgumentException.class, () -> new DurationValue.Known(-1));
    }
}
