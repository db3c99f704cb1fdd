package com.slapulse.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One proactive-outreach suggestion for an operator task list.
 *
 * @param id               stable identifier, unique within one evaluation
 * @param title            short call to action
 * @param message          operator-facing explanation
 * @param priority         urgency used for ordering and risk rating
 * @param category         grouping for display
 * @param dueAt            deadline the action should be taken by, or null
 * @param supportingMetric short metric backing the suggestion, or null
 */
public record Recommendation(
    String id,
    String title,
    String message,
    RecommendationPriority priority,
    RecommendationCategory category,
    Instant dueAt,
    String supportingMetric
) {

    public Recommendation {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(category, "category must not be null");
    }
}
