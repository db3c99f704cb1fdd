package com.slapulse.model;

import java.util.List;

/**
 * Everything one evaluation produces for a referral detail view.
 */
public record SlaInsights(List<SlaDuration> durations, List<Recommendation> recommendations, RiskSummary riskSummary) {

    public SlaInsights {
        durations = List.copyOf(durations);
        recommendations = List.copyOf(recommendations);
    }
}
