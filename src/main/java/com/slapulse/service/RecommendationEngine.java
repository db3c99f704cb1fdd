package com.slapulse.service;

import com.slapulse.model.Recommendation;
import com.slapulse.model.ReferralSnapshot;
import com.slapulse.model.SlaDuration;
import com.slapulse.service.rules.CaseClock;
import com.slapulse.service.rules.RecommendationRuleSet;
import com.slapulse.service.rules.RuleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a referral against the rule set of its origin and returns the
 * resulting recommendations, deduplicated by id and ordered for a task list.
 */
@Service
public class RecommendationEngine {

    private static final Logger log = LoggerFactory.getLogger(RecommendationEngine.class);

    /**
     * Priority first, then soonest due date with undated items last. The list
     * sort is stable, so remaining ties keep rule order.
     */
    static final Comparator<Recommendation> TASK_ORDER = Comparator
        .comparingInt((Recommendation r) -> r.priority().getWeight())
        .thenComparing(Recommendation::dueAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<RecommendationRuleSet> ruleSets;

    @Autowired
    public RecommendationEngine(List<RecommendationRuleSet> ruleSets) {
        this.ruleSets = List.copyOf(ruleSets);
    }

    public List<Recommendation> evaluate(ReferralSnapshot snapshot, List<SlaDuration> durations, Instant now) {
        RecommendationRuleSet ruleSet = ruleSetFor(snapshot);
        if (ruleSet == null) {
            log.warn("No recommendation rules for origin {} on referral {}", snapshot.origin(), snapshot.id());
            return List.of();
        }

        RuleContext context = new RuleContext(snapshot, durations, CaseClock.of(snapshot, now));
        Map<String, Recommendation> byId = new LinkedHashMap<>();
        for (Recommendation recommendation : ruleSet.evaluate(context)) {
            if (byId.putIfAbsent(recommendation.id(), recommendation) != null) {
                log.debug("Dropping duplicate recommendation {} for referral {}", recommendation.id(), snapshot.id());
            }
        }

        List<Recommendation> sorted = new ArrayList<>(byId.values());
        sorted.sort(TASK_ORDER);
        return sorted;
    }

    private RecommendationRuleSet ruleSetFor(ReferralSnapshot snapshot) {
        for (RecommendationRuleSet ruleSet : ruleSets) {
            if (ruleSet.supports(snapshot.origin())) {
                return ruleSet;
            }
        }
        return null;
    }
}
