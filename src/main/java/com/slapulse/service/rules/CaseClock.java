package com.slapulse.service.rules;

import com.slapulse.model.Note;
import com.slapulse.model.ReferralSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Wall-clock ages of a referral at one evaluation instant.
 *
 * Ages are whole units, truncated. A missing status timestamp falls back to
 * creation, a missing creation to the evaluation instant.
 */
public record CaseClock(
    Instant now,
    Instant createdAt,
    Instant statusLastUpdated,
    long minutesSinceStatusUpdate,
    long hoursSinceStatusUpdate,
    long daysInStatus,
    Instant latestNoteAt,
    Long hoursSinceLastNote
) {

    public static CaseClock of(ReferralSnapshot snapshot, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Instant createdAt = snapshot.createdAt() != null ? snapshot.createdAt() : now;
        Instant statusLastUpdated = snapshot.statusLastUpdated() != null ? snapshot.statusLastUpdated() : createdAt;

        Duration sinceStatus = Duration.between(statusLastUpdated, now);
        long daysInStatus = snapshot.daysInStatus() != null ? snapshot.daysInStatus() : sinceStatus.toDays();

        Instant latestNoteAt = snapshot.notes().stream()
            .map(Note::createdAt)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(null);
        Long hoursSinceLastNote = latestNoteAt != null ? Duration.between(latestNoteAt, now).toHours() : null;

        return new CaseClock(now, createdAt, statusLastUpdated, sinceStatus.toMinutes(), sinceStatus.toHours(),
            daysInStatus, latestNoteAt, hoursSinceLastNote);
    }

    public boolean noteOlderThanHours(long hours) {
        return hoursSinceLastNote != null && hoursSinceLastNote > hours;
    }

    /**
     * True when no dated note was logged at or after the last status change.
     */
    public boolean noNoteSinceStatusChange() {
        return latestNoteAt == null || latestNoteAt.isBefore(statusLastUpdated);
    }
}
