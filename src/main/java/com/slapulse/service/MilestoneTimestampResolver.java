package com.slapulse.service;

import com.slapulse.model.AuditEntry;
import com.slapulse.model.Deal;
import com.slapulse.model.DealStatus;
import com.slapulse.model.PipelineStatus;
import com.slapulse.model.ReferralSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Resolves the instant each named milestone was first reached.
 *
 * Status milestones come from the status audit log. Deal milestones come from
 * the deal records with audit fallbacks. Results are not checked against each
 * other: a corrected audit entry can make a later milestone resolve earlier,
 * and callers get a null duration for such pairs.
 */
@Component
public class MilestoneTimestampResolver {

    /**
     * Status audit entries with a timestamp, oldest first.
     */
    public List<AuditEntry> sortedStatusAudit(ReferralSnapshot snapshot) {
        return snapshot.audit().stream()
            .filter(AuditEntry::isStatusChange)
            .filter(entry -> entry.timestamp() != null)
            .sorted(Comparator.comparing(AuditEntry::timestamp))
            .collect(Collectors.toList());
    }

    /**
     * First time the referral entered the given status, or null.
     */
    public Instant firstStatusTimestamp(ReferralSnapshot snapshot, PipelineStatus status) {
        return firstStatusTimestamp(snapshot, sortedStatusAudit(snapshot), status);
    }

    private Instant firstStatusTimestamp(ReferralSnapshot snapshot, List<AuditEntry> sortedAudit,
                                         PipelineStatus status) {
        for (AuditEntry entry : sortedAudit) {
            if (status.getLabel().equals(entry.newValue())) {
                return entry.timestamp();
            }
        }
        if (snapshot.status() == status) {
            return snapshot.statusLastUpdated() != null ? snapshot.statusLastUpdated() : snapshot.createdAt();
        }
        return null;
    }

    /**
     * When the current contract cycle was reached.
     *
     * Only resolved when some deal shows contract progress or the referral
     * itself sits in a contracting status.
     */
    public Instant contractReachedAt(ReferralSnapshot snapshot) {
        boolean dealProgress = snapshot.deals().stream()
            .map(Deal::dealStatus)
            .anyMatch(status -> status != null && status.isPostContract());
        if (!dealProgress && !snapshot.status().isContracting()) {
            return null;
        }

        Instant earliestDeal = earliestDeal(snapshot, DealStatus::isPostContract,
            deal -> firstNonNull(deal.createdAt(), deal.updatedAt()));
        if (earliestDeal != null) {
            return earliestDeal;
        }
        List<AuditEntry> sortedAudit = sortedStatusAudit(snapshot);
        Instant underContract = firstStatusTimestamp(snapshot, sortedAudit, PipelineStatus.UNDER_CONTRACT);
        if (underContract != null) {
            return underContract;
        }
        Instant paired = firstStatusTimestamp(snapshot, sortedAudit, PipelineStatus.PAIRED);
        return paired != null ? paired : snapshot.createdAt();
    }

    public Instant closedAt(ReferralSnapshot snapshot) {
        Instant earliestDeal = earliestDeal(snapshot, DealStatus::isClosedOrLater,
            deal -> firstNonNull(deal.updatedAt(), deal.createdAt()));
        if (earliestDeal != null) {
            return earliestDeal;
        }
        return firstStatusTimestamp(snapshot, PipelineStatus.CLOSED);
    }

    public Instant paidAt(ReferralSnapshot snapshot) {
        return earliestDeal(snapshot, status -> status == DealStatus.PAID,
            deal -> firstNonNull(deal.paidAt(), firstNonNull(deal.updatedAt(), deal.createdAt())));
    }

    private Instant earliestDeal(ReferralSnapshot snapshot, Predicate<DealStatus> qualifies,
                                 Function<Deal, Instant> timestamp) {
        return snapshot.deals().stream()
            .filter(deal -> deal.dealStatus() != null && qualifies.test(deal.dealStatus()))
            .map(timestamp)
            .filter(Objects::nonNull)
            .min(Comparator.naturalOrder())
            .orElse(null);
    }

    private static Instant firstNonNull(Instant first, Instant second) {
        return first != null ? first : second;
    }
}
