package com.slapulse.model;

import com.slapulse.util.DurationFormatter;

import java.util.Objects;

public record SlaDuration(DurationKey key, DurationValue value) {

    public SlaDuration {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public String label() {
        return key.getLabel();
    }

    public Long minutes() {
        return value.minutes();
    }

    public String formatted() {
        return DurationFormatter.format(value);
    }
}
