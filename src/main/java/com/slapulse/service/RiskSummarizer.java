package com.slapulse.service;

import com.slapulse.model.Recommendation;
import com.slapulse.model.RecommendationPriority;
import com.slapulse.model.RiskLevel;
import com.slapulse.model.RiskSummary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Collapses a recommendation list into one rating for a status badge.
 *
 * Missing signal never raises the rating: an empty list is on track.
 */
@Component
public class RiskSummarizer {

    public RiskSummary summarize(List<Recommendation> recommendations) {
        if (recommendations.isEmpty()) {
            return new RiskSummary(RiskLevel.ON_TRACK,
                "All milestones are on track",
                "SLA clocks are healthy and no proactive outreach is required right now.");
        }
        if (anyWithPriority(recommendations, RecommendationPriority.URGENT)) {
            return new RiskSummary(RiskLevel.AT_RISK,
                "Critical SLA risk detected",
                "Immediate attention is needed to protect this referral before SLAs are breached.");
        }
        if (anyWithPriority(recommendations, RecommendationPriority.HIGH)) {
            return new RiskSummary(RiskLevel.WATCH,
                "Important follow-ups recommended",
                "Address the recommended actions soon to keep the borrower journey on track.");
        }
        return new RiskSummary(RiskLevel.ON_TRACK,
            "Minor optimizations available",
            "Consider the suggested touchpoints to keep momentum with the borrower.");
    }

    private static boolean anyWithPriority(List<Recommendation> recommendations, RecommendationPriority priority) {
        return recommendations.stream().anyMatch(item -> item.priority() == priority);
    }
}
