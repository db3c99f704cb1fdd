package com.slapulse.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of a referral case as handed to the engine.
 *
 * Timestamps may be null when the record system had no usable value.
 * Collections are copied on construction and are never null.
 */
public record ReferralSnapshot(
    String id,
    Instant createdAt,
    PipelineStatus status,
    Instant statusLastUpdated,
    ReferralOrigin origin,
    boolean agentAssigned,
    boolean lenderAssigned,
    List<Note> notes,
    List<Deal> deals,
    List<AuditEntry> audit,
    SlaCarryForward sla,
    Integer daysInStatus
) {

    public ReferralSnapshot {
        Objects.requireNonNull(id, "id must not be null");
        status = status == null ? PipelineStatus.NEW_LEAD : status;
        origin = origin == null ? ReferralOrigin.MC : origin;
        notes = copyOf(notes);
        deals = copyOf(deals);
        audit = copyOf(audit);
        sla = sla == null ? SlaCarryForward.empty() : sla;
    }

    // List.copyOf rejects null elements; skip them instead
    private static <T> List<T> copyOf(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(source.size());
        for (T item : source) {
            if (item != null) {
                copy.add(item);
            }
        }
        return Collections.unmodifiableList(copy);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Fluent builder used by mappers and tests.
     */
    public static final class Builder {
        private final String id;
        private Instant createdAt;
        private PipelineStatus status;
        private Instant statusLastUpdated;
        private ReferralOrigin origin;
        private boolean agentAssigned;
        private boolean lenderAssigned;
        private final List<Note> notes = new ArrayList<>();
        private final List<Deal> deals = new ArrayList<>();
        private final List<AuditEntry> audit = new ArrayList<>();
        private SlaCarryForward sla;
        private Integer daysInStatus;

        private Builder(String id) {
            this.id = id;
        }

        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder status(PipelineStatus status) { this.status = status; return this; }
        public Builder statusLastUpdated(Instant statusLastUpdated) { this.statusLastUpdated = statusLastUpdated; return this; }
        public Builder origin(ReferralOrigin origin) { this.origin = origin; return this; }
        public Builder agentAssigned(boolean agentAssigned) { this.agentAssigned = agentAssigned; return this; }
        public Builder lenderAssigned(boolean lenderAssigned) { this.lenderAssigned = lenderAssigned; return this; }
        public Builder note(Note note) { this.notes.add(note); return this; }
        public Builder notes(List<Note> notes) { this.notes.addAll(notes); return this; }
        public Builder deal(Deal deal) { this.deals.add(deal); return this; }
        public Builder deals(List<Deal> deals) { this.deals.addAll(deals); return this; }
        public Builder audit(AuditEntry entry) { this.audit.add(entry); return this; }
        public Builder audit(List<AuditEntry> entries) { this.audit.addAll(entries); return this; }
        public Builder statusChange(PipelineStatus newStatus, Instant at) {
            this.audit.add(new AuditEntry(AuditEntry.STATUS_FIELD, newStatus.getLabel(), at));
            return this;
        }
        public Builder sla(SlaCarryForward sla) { this.sla = sla; return this; }
        public Builder daysInStatus(Integer daysInStatus) { this.daysInStatus = daysInStatus; return this; }

        public ReferralSnapshot build() {
            return new ReferralSnapshot(id, createdAt, status, statusLastUpdated, origin,
                agentAssigned, lenderAssigned, notes, deals, audit, sla, daysInStatus);
        }
    }
}
