package com.slapulse.service.rules;

import com.slapulse.model.Recommendation;
import com.slapulse.model.ReferralOrigin;

import java.util.List;

/**
 * Threshold rules for one workflow variant.
 */
public interface RecommendationRuleSet {

    boolean supports(ReferralOrigin origin);

    /**
     * Recommendations in rule order. Ordering by priority happens in the engine.
     */
    List<Recommendation> evaluate(RuleContext context);
}
