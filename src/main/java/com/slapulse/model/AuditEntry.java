package com.slapulse.model;

import java.time.Instant;

/**
 * One append-only change record on a referral.
 */
public record AuditEntry(String field, String newValue, Instant timestamp) {

    public static final String STATUS_FIELD = "status";

    public boolean isStatusChange() {
        return STATUS_FIELD.equals(field);
    }
}
