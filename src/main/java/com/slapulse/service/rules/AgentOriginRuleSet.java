package com.slapulse.service.rules;

import com.slapulse.config.SlaThresholds;
import com.slapulse.model.PipelineStatus;
import com.slapulse.model.Recommendation;
import com.slapulse.model.RecommendationCategory;
import com.slapulse.model.RecommendationPriority;
import com.slapulse.model.ReferralOrigin;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Rules for agent-originated referrals, where the receiving side is a
 * mortgage consultant and there is no agent pairing step.
 */
@Component
public class AgentOriginRuleSet implements RecommendationRuleSet {

    static final String ASSIGN_MC = "assign-mc-agent-origin";
    static final String CONFIRM_BORROWER_INTRO = "confirm-borrower-intro";
    static final String SHARE_AGENT_UPDATE = "share-agent-update";
    static final String PLAN_NEXT_STEP = "plan-next-step";

    private final SlaThresholds thresholds;

    @Autowired
    public AgentOriginRuleSet(SlaThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public boolean supports(ReferralOrigin origin) {
        return origin.isSelfOriginated();
    }

    @Override
    public List<Recommendation> evaluate(RuleContext context) {
        CaseClock clock = context.clock();
        PipelineStatus status = context.status();
        boolean lenderAssigned = context.snapshot().lenderAssigned();
        List<Recommendation> recommendations = new ArrayList<>();

        if (!lenderAssigned) {
            recommendations.add(new Recommendation(
                ASSIGN_MC,
                "Assign a mortgage consultant",
                "Choose the MC who will take this referral so they can contact the borrower without delay.",
                RecommendationPriority.URGENT,
                RecommendationCategory.ASSIGNMENT,
                clock.createdAt().plus(Duration.ofHours(thresholds.hoursToLenderAssignment())),
                "Awaiting MC assignment"));
        }

        if (lenderAssigned
            && (status == PipelineStatus.NEW_LEAD || status == PipelineStatus.PAIRED)
            && clock.hoursSinceStatusUpdate() >= thresholds.hoursToBorrowerIntro()) {
            recommendations.add(new Recommendation(
                CONFIRM_BORROWER_INTRO,
                "Confirm borrower outreach",
                "Make sure the MC has introduced themselves to the borrower and acknowledged the referral.",
                RecommendationPriority.HIGH,
                RecommendationCategory.COMMUNICATION,
                clock.statusLastUpdated().plus(Duration.ofHours(thresholds.hoursToBorrowerIntro())),
                clock.hoursSinceStatusUpdate() + "h since transfer"));
        }

        if (clock.noteOlderThanHours(thresholds.hoursWithoutNote())) {
            recommendations.add(new Recommendation(
                SHARE_AGENT_UPDATE,
                "Share an update with the referring agent",
                "Log a quick note so the referring agent knows how the borrower conversation is progressing.",
                RecommendationPriority.MEDIUM,
                RecommendationCategory.COMMUNICATION,
                null,
                "Last update " + clock.hoursSinceLastNote() + "h ago"));
        }

        if (status == PipelineStatus.IN_COMMUNICATION
            && clock.hoursSinceStatusUpdate() >= thresholds.hoursCommunicationStalled()) {
            recommendations.add(new Recommendation(
                PLAN_NEXT_STEP,
                "Plan the borrower's next milestone",
                "Suggest documents, education, or follow-ups to keep the borrower moving forward.",
                RecommendationPriority.MEDIUM,
                RecommendationCategory.PIPELINE,
                clock.statusLastUpdated().plus(Duration.ofHours(thresholds.hoursCommunicationStalled())),
                clock.hoursSinceStatusUpdate() + "h in current stage"));
        }

        return recommendations;
    }
}
