package com.slapulse.service.rules;

import com.slapulse.config.SlaThresholds;
import com.slapulse.model.DurationKey;
import com.slapulse.model.PipelineStatus;
import com.slapulse.model.Recommendation;
import com.slapulse.model.RecommendationCategory;
import com.slapulse.model.RecommendationPriority;
import com.slapulse.model.ReferralOrigin;
import com.slapulse.util.DurationFormatter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Rules for referrals that go through agent pairing (MC and admin origin).
 */
@Component
public class StandardRuleSet implements RecommendationRuleSet {

    static final String ASSIGN_AGENT = "assign-agent";
    static final String COACH_INITIAL_OUTREACH = "coach-initial-outreach";
    static final String NUDGE_FIRST_CONVERSATION = "nudge-first-conversation";
    static final String LOG_COMMUNICATION_UPDATE = "log-communication-update";
    static final String SCHEDULE_CHECK_IN = "schedule-proactive-check-in";
    static final String REFRESH_ACTIVITY_LOG = "refresh-activity-log";
    static final String REVIEW_CONVERSION_PLAN = "review-conversion-plan";
    static final String CHECK_ESCROW_MILESTONES = "check-escrow-milestones";
    static final String CONFIRM_REFERRAL_FEE = "confirm-referral-fee";
    static final String CAPTURE_TERMINATION_REASON = "capture-termination-reason";

    private final SlaThresholds thresholds;

    @Autowired
    public StandardRuleSet(SlaThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public boolean supports(ReferralOrigin origin) {
        return !origin.isSelfOriginated();
    }

    @Override
    public List<Recommendation> evaluate(RuleContext context) {
        List<Recommendation> recommendations = new ArrayList<>();
        assignment(context, recommendations);

        switch (context.status()) {
            case PAIRED -> paired(context, recommendations);
            case IN_COMMUNICATION, SHOWING_HOMES -> communicating(context, recommendations);
            case UNDER_CONTRACT -> underContract(context, recommendations);
            case CLOSED -> closed(context, recommendations);
            case TERMINATED, LOST -> terminated(context, recommendations);
            default -> {
                // no status-specific rules
            }
        }
        return recommendations;
    }

    private void assignment(RuleContext context, List<Recommendation> out) {
        CaseClock clock = context.clock();
        long assignmentSla = thresholds.minutesToAssignment();

        if (!context.snapshot().agentAssigned()) {
            out.add(new Recommendation(
                ASSIGN_AGENT,
                "Assign an agent",
                "No partner agent is assigned. Route this referral before the SLA breach.",
                RecommendationPriority.URGENT,
                RecommendationCategory.ASSIGNMENT,
                clock.createdAt().plus(Duration.ofMinutes(assignmentSla)),
                "Assignment SLA: " + DurationFormatter.formatMinutes(assignmentSla)));
            return;
        }

        if (context.status() != PipelineStatus.NEW_LEAD) {
            return;
        }
        Long leadToPaired = context.minutes(DurationKey.NEW_LEAD_TO_PAIRED);
        boolean slowPairing = leadToPaired != null && leadToPaired > assignmentSla;
        if (clock.minutesSinceStatusUpdate() > assignmentSla || slowPairing) {
            out.add(new Recommendation(
                COACH_INITIAL_OUTREACH,
                "Confirm first touchpoint",
                "It has taken longer than " + DurationFormatter.formatMinutes(assignmentSla)
                    + " to connect. Confirm the agent reached out to the borrower.",
                RecommendationPriority.HIGH,
                RecommendationCategory.COMMUNICATION,
                clock.statusLastUpdated().plus(Duration.ofMinutes(assignmentSla)),
                "Current lead-to-pairing: " + (leadToPaired != null
                    ? DurationFormatter.formatMinutes(leadToPaired) : DurationFormatter.PENDING)));
        }
    }

    private void paired(RuleContext context, List<Recommendation> out) {
        CaseClock clock = context.clock();
        if (clock.hoursSinceStatusUpdate() > thresholds.hoursToFirstConversation()) {
            out.add(new Recommendation(
                NUDGE_FIRST_CONVERSATION,
                "Prompt first borrower conversation",
                "Follow up with the agent to ensure they have scheduled an introduction call.",
                RecommendationPriority.HIGH,
                RecommendationCategory.COMMUNICATION,
                clock.statusLastUpdated().plus(Duration.ofHours(thresholds.hoursToFirstConversation())),
                "Hours since paired: " + clock.hoursSinceStatusUpdate()));
        }
        if (context.minutes(DurationKey.PAIRED_TO_COMMUNICATION) == null) {
            out.add(new Recommendation(
                LOG_COMMUNICATION_UPDATE,
                "Capture communication progress",
                "Record a timeline update once the agent makes contact so SLA tracking stays accurate.",
                RecommendationPriority.MEDIUM,
                RecommendationCategory.OPS,
                null,
                "Awaiting communication milestone"));
        }
    }

    private void communicating(RuleContext context, List<Recommendation> out) {
        CaseClock clock = context.clock();
        long days = clock.daysInStatus();

        if (days >= thresholds.daysWithoutTouchPoint()) {
            out.add(new Recommendation(
                SCHEDULE_CHECK_IN,
                "Schedule a proactive check-in",
                "It has been a few days without movement. Suggest next steps or resources to keep momentum.",
                RecommendationPriority.MEDIUM,
                RecommendationCategory.COMMUNICATION,
                clock.statusLastUpdated().plus(Duration.ofDays(thresholds.daysWithoutTouchPoint())),
                days + " days in current stage"));
        }
        if (clock.noteOlderThanHours(thresholds.hoursWithoutNote())) {
            out.add(new Recommendation(
                REFRESH_ACTIVITY_LOG,
                "Update the activity log",
                "Log a quick note or call outcome so the team has the latest borrower context.",
                RecommendationPriority.LOW,
                RecommendationCategory.OPS,
                null,
                "Last note " + clock.hoursSinceLastNote() + "h ago"));
        }
        if (context.minutes(DurationKey.COMMUNICATION_TO_CONTRACT) == null
            && days >= thresholds.daysToUnderContract()) {
            out.add(new Recommendation(
                REVIEW_CONVERSION_PLAN,
                "Review conversion plan",
                "Share open houses, financing refreshers, or incentives to help the borrower move forward.",
                RecommendationPriority.MEDIUM,
                RecommendationCategory.PIPELINE,
                clock.statusLastUpdated().plus(Duration.ofDays(thresholds.daysToUnderContract())),
                days + " days without contract"));
        }
    }

    private void underContract(RuleContext context, List<Recommendation> out) {
        CaseClock clock = context.clock();
        if (context.minutes(DurationKey.CONTRACT_TO_CLOSE) == null
            && clock.daysInStatus() >= thresholds.daysToClose()) {
            out.add(new Recommendation(
                CHECK_ESCROW_MILESTONES,
                "Check escrow milestones",
                "Confirm appraisal, inspection, and financing checkpoints are on track to avoid delays.",
                RecommendationPriority.HIGH,
                RecommendationCategory.PIPELINE,
                clock.statusLastUpdated().plus(Duration.ofDays(thresholds.daysToClose())),
                clock.daysInStatus() + " days since contract"));
        }
    }

    private void closed(RuleContext context, List<Recommendation> out) {
        CaseClock clock = context.clock();
        if (context.minutes(DurationKey.CLOSE_TO_PAID) == null
            && clock.daysInStatus() >= thresholds.daysToPaymentAfterClose()) {
            out.add(new Recommendation(
                CONFIRM_REFERRAL_FEE,
                "Confirm referral fee payment",
                "Closed files should have invoices tracked. Verify the payment status and log receipt.",
                RecommendationPriority.MEDIUM,
                RecommendationCategory.FINANCE,
                clock.statusLastUpdated().plus(Duration.ofDays(thresholds.daysToPaymentAfterClose())),
                "Awaiting payment confirmation"));
        }
    }

    private void terminated(RuleContext context, List<Recommendation> out) {
        CaseClock clock = context.clock();
        if (clock.hoursSinceStatusUpdate() >= thresholds.hoursToTerminationReason()
            && clock.noNoteSinceStatusChange()) {
            out.add(new Recommendation(
                CAPTURE_TERMINATION_REASON,
                "Capture termination context",
                "Document the reason for termination to inform performance analytics and follow-up campaigns.",
                RecommendationPriority.MEDIUM,
                RecommendationCategory.OPS,
                clock.statusLastUpdated().plus(Duration.ofHours(thresholds.hoursToTerminationReason())),
                "No note in " + clock.hoursSinceStatusUpdate() + "h since " + context.status().getLabel()));
        }
    }
}
