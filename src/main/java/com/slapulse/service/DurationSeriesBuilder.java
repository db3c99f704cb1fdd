package com.slapulse.service;

import com.slapulse.calendar.BusinessDurationCalculator;
import com.slapulse.model.DurationKey;
import com.slapulse.model.DurationValue;
import com.slapulse.model.PipelineStatus;
import com.slapulse.model.ReferralSnapshot;
import com.slapulse.model.SlaCarryForward;
import com.slapulse.model.SlaDuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the ordered milestone-to-milestone duration chain for one referral.
 *
 * While a referral sits in a pre-contract status the deal legs are pending,
 * whatever stale deal records say: a prior attempt fell through and the new
 * cycle has no fresh milestones yet. The stored carry-forward values are
 * surfaced as history instead.
 */
@Service
public class DurationSeriesBuilder {

    private static final Logger log = LoggerFactory.getLogger(DurationSeriesBuilder.class);

    private final MilestoneTimestampResolver resolver;
    private final BusinessDurationCalculator calculator;

    @Autowired
    public DurationSeriesBuilder(MilestoneTimestampResolver resolver, BusinessDurationCalculator calculator) {
        this.resolver = resolver;
        this.calculator = calculator;
    }

    public List<SlaDuration> build(ReferralSnapshot snapshot) {
        Instant createdAt = snapshot.createdAt();
        Instant pairedAt = resolver.firstStatusTimestamp(snapshot, PipelineStatus.PAIRED);
        Instant communicatingAt = resolver.firstStatusTimestamp(snapshot, PipelineStatus.IN_COMMUNICATION);
        Instant showingHomesAt = resolver.firstStatusTimestamp(snapshot, PipelineStatus.SHOWING_HOMES);
        Instant underContractAt = resolver.firstStatusTimestamp(snapshot, PipelineStatus.UNDER_CONTRACT);

        Instant dealContractAt = resolver.contractReachedAt(snapshot);
        Instant dealClosedAt = resolver.closedAt(snapshot);
        Instant dealPaidAt = resolver.paidAt(snapshot);

        Instant communicationStart = firstNonNull(showingHomesAt, communicatingAt, pairedAt, createdAt);

        Long leadToPaired = calculator.businessMinutesBetween(createdAt, pairedAt);
        Long pairedToCommunication = calculator.businessMinutesBetween(pairedAt, communicatingAt);
        Long communicationToContract = calculator.businessMinutesBetween(communicationStart, underContractAt);
        Long contractToClose = calculator.businessMinutesBetween(dealContractAt, dealClosedAt);
        Long closeToPaid = calculator.businessMinutesBetween(dealClosedAt, dealPaidAt);

        SlaCarryForward sla = snapshot.sla();
        boolean preContract = snapshot.status().isPreContract();

        DurationValue contractToCloseValue;
        DurationValue closeToPaidValue;
        if (preContract) {
            contractToCloseValue = DurationValue.of(null,
                firstNonNull(sla.previousContractToCloseMinutes(), sla.contractToCloseMinutes()));
            closeToPaidValue = DurationValue.of(null,
                firstNonNull(sla.previousClosedToPaidMinutes(), sla.closedToPaidMinutes()));
        } else {
            contractToCloseValue = DurationValue.of(
                firstNonNull(contractToClose, sla.contractToCloseMinutes()), sla.previousContractToCloseMinutes());
            closeToPaidValue = DurationValue.of(
                firstNonNull(closeToPaid, sla.closedToPaidMinutes()), sla.previousClosedToPaidMinutes());
        }

        List<SlaDuration> durations = new ArrayList<>();
        durations.add(new SlaDuration(DurationKey.NEW_LEAD_TO_PAIRED, DurationValue.of(leadToPaired, null)));
        durations.add(new SlaDuration(DurationKey.PAIRED_TO_COMMUNICATION, DurationValue.of(pairedToCommunication, null)));
        durations.add(new SlaDuration(DurationKey.COMMUNICATION_TO_CONTRACT, DurationValue.of(communicationToContract, null)));
        durations.add(new SlaDuration(DurationKey.CONTRACT_TO_CLOSE, contractToCloseValue));
        if (!snapshot.origin().isSelfOriginated()) {
            durations.add(new SlaDuration(DurationKey.CLOSE_TO_PAID, closeToPaidValue));
        }

        log.debug("Built {} durations for referral {} (status={}, preContract={})",
            durations.size(), snapshot.id(), snapshot.status(), preContract);
        return durations;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
