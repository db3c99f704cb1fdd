package com.slapulse.service;

import com.slapulse.model.Recommendation;
import com.slapulse.model.ReferralSnapshot;
import com.slapulse.model.RiskSummary;
import com.slapulse.model.SlaDuration;
import com.slapulse.model.SlaInsights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for one referral evaluation: durations, recommendations and risk.
 *
 * The result is a pure function of the snapshot and the evaluation instant.
 */
@Service
public class SlaInsightsService {

    private static final Logger log = LoggerFactory.getLogger(SlaInsightsService.class);

    private final DurationSeriesBuilder durationSeriesBuilder;
    private final RecommendationEngine recommendationEngine;
    private final RiskSummarizer riskSummarizer;
    private final Clock clock;

    @Autowired
    public SlaInsightsService(DurationSeriesBuilder durationSeriesBuilder,
                              RecommendationEngine recommendationEngine,
                              RiskSummarizer riskSummarizer,
                              Clock clock) {
        this.durationSeriesBuilder = durationSeriesBuilder;
        this.recommendationEngine = recommendationEngine;
        this.riskSummarizer = riskSummarizer;
        this.clock = clock;
    }

    public SlaInsights evaluate(ReferralSnapshot snapshot) {
        return evaluate(snapshot, clock.instant());
    }

    public SlaInsights evaluate(ReferralSnapshot snapshot, Instant now) {
        List<SlaDuration> durations = durationSeriesBuilder.build(snapshot);
        List<Recommendation> recommendations = recommendationEngine.evaluate(snapshot, durations, now);
        RiskSummary riskSummary = riskSummarizer.summarize(recommendations);

        log.debug("Evaluated referral {} at {}: {} recommendations, risk {}",
            snapshot.id(), now, recommendations.size(), riskSummary.level());
        return new SlaInsights(durations, recommendations, riskSummary);
    }
}
