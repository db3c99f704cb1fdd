package com.slapulse.unit;

import com.slapulse.model.Recommendation;
import com.slapulse.model.RecommendationCategory;
import com.slapulse.model.RecommendationPriority;
import com.slapulse.model.ReferralOrigin;
import com.slapulse.model.ReferralSnapshot;
import com.slapulse.service.RecommendationEngine;
import com.slapulse.service.rules.RecommendationRuleSet;
import com.slapulse.service.rules.RuleContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static com.slapulse.SlaTestSupport.denver;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@Tag("unit")
public class RecommendationEngineTest {

    @Mock
    private RecommendationRuleSet agentRules;

    @Mock
    private RecommendationRuleSet standardRules;

    private RecommendationEngine engine;

    private final Instant now = denver("2025-06-04T12:00");

    @BeforeEach
    void setUp() {
        engine = new RecommendationEngine(List.of(agentRules, standardRules));
    }

    private static ReferralSnapshot snapshot(ReferralOrigin origin) {
        return ReferralSnapshot.builder("r-42")
            .createdAt(denver("2025-06-02T09:00"))
            .origin(origin)
            .build();
    }

    private static Recommendation rec(String id, RecommendationPriority priority, Instant dueAt) {
        return new Recommendation(id, "Title " + id, "Message " + id, priority,
            RecommendationCategory.OPS, dueAt, null);
    }

    private static List<String> ids(List<Recommendation> recommendations) {
        return recommendations.stream().map(Recommendation::id).collect(Collectors.toList());
    }

    @Test
    void test_dispatches_to_rule_set_for_origin() {
        when(agentRules.supports(ReferralOrigin.AGENT)).thenReturn(true);
        when(agentRules.evaluate(any())).thenReturn(List.of(rec("a", RecommendationPriority.LOW, null)));

        List<Recommendation> result = engine.evaluate(snapshot(ReferralOrigin.AGENT), List.of(), now);

        assertEquals(List.of("a"), ids(result));
        verify(standardRules, never()).supports(any());
        verify(standardRules, never()).evaluate(any());
    }

    @Test
    void test_falls_through_to_next_supporting_rule_set() {
        when(agentRules.supports(ReferralOrigin.ADMIN)).thenReturn(false);
        when(standardRules.supports(ReferralOrigin.ADMIN)).thenReturn(true);
        when(standardRules.evaluate(any())).thenReturn(List.of());

        assertTrue(engine.evaluate(snapshot(ReferralOrigin.ADMIN), List.of(), now).isEmpty());
        verify(agentRules, never()).evaluate(any());
    }

    @Test
    void test_rule_context_carries_evaluation_instant() {
        when(agentRules.supports(ReferralOrigin.MC)).thenReturn(false);
        when(standardRules.supports(ReferralOrigin.MC)).thenReturn(true);
        when(standardRules.evaluate(any())).thenReturn(List.of());

        ReferralSnapshot snapshot = snapshot(ReferralOrigin.MC);
        engine.evaluate(snapshot, List.of(), now);

        ArgumentCaptor<RuleContext> captor = ArgumentCaptor.forClass(RuleContext.class);
        verify(standardRules).evaluate(captor.capture());
        RuleContext context = captor.getValue();
        assertSame(snapshot, context.snapshot());
        assertEquals(now, context.clock().now());
        assertEquals(Duration.ofHours(51).toMinutes(), context.clock().minutesSinceStatusUpdate());
    }

    @Test
    void test_duplicate_ids_keep_first_occurrence() {
        Recommendation first = rec("dup", RecommendationPriority.MEDIUM, null);
        Recommendation second = rec("dup", RecommendationPriority.URGENT, null);
        when(agentRules.supports(ReferralOrigin.AGENT)).thenReturn(true);
        when(agentRules.evaluate(any())).thenReturn(List.of(first, second));

        List<Recommendation> result = engine.evaluate(snapshot(ReferralOrigin.AGENT), List.of(), now);

        assertEquals(1, result.size());
        assertSame(first, result.get(0));
    }

    @Test
    void test_orders_by_priority_then_due_date_then_rule_order() {
        Instant soon = now.plus(Duration.ofHours(1));
        Instant later = now.plus(Duration.ofHours(5));
        when(agentRules.supports(ReferralOrigin.AGENT)).thenReturn(true);
        when(agentRules.evaluate(any())).thenReturn(List.of(
            rec("low", RecommendationPriority.LOW, soon),
            rec("medium-undated-1", RecommendationPriority.MEDIUM, null),
            rec("medium-later", RecommendationPriority.MEDIUM, later),
            rec("urgent", RecommendationPriority.URGENT, later),
            rec("medium-undated-2", RecommendationPriority.MEDIUM, null),
            rec("medium-soon", RecommendationPriority.MEDIUM, soon),
            rec("high", RecommendationPriority.HIGH, null)));

        List<Recommendation> result = engine.evaluate(snapshot(ReferralOrigin.AGENT), List.of(), now);

        assertEquals(List.of("urgent", "high", "medium-soon", "medium-later",
            "medium-undated-1", "medium-undated-2", "low"), ids(result));
    }

    @Test
    void test_no_supporting_rule_set_yields_empty_list() {
        when(agentRules.supports(ReferralOrigin.MC)).thenReturn(false);
        when(standardRules.supports(ReferralOrigin.MC)).thenReturn(false);

        assertTrue(engine.evaluate(snapshot(ReferralOrigin.MC), List.of(), now).isEmpty());
        verify(agentRules, never()).evaluate(any());
        verify(standardRules, never()).evaluate(any());
    }
}
