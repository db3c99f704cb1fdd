package com.slapulse.unit;

import com.slapulse.SlaTestSupport;
import com.slapulse.config.SlaThresholds;
import com.slapulse.model.Note;
import com.slapulse.model.PipelineStatus;
import com.slapulse.model.Recommendation;
import com.slapulse.model.RecommendationCategory;
import com.slapulse.model.RecommendationPriority;
import com.slapulse.model.ReferralOrigin;
import com.slapulse.model.ReferralSnapshot;
import com.slapulse.model.SlaCarryForward;
import com.slapulse.service.DurationSeriesBuilder;
import com.slapulse.service.rules.CaseClock;
import com.slapulse.service.rules.RuleContext;
import com.slapulse.service.rules.StandardRuleSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static com.slapulse.SlaTestSupport.denver;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class StandardRuleSetTest {

    private StandardRuleSet ruleSet;
    private DurationSeriesBuilder durations;

    private final Instant created = denver("2025-06-02T09:00");

    @BeforeEach
    void setUp() {
        ruleSet = new StandardRuleSet(SlaThresholds.defaults());
        durations = SlaTestSupport.durationSeriesBuilder();
    }

    private List<Recommendation> evaluate(ReferralSnapshot snapshot, Instant now) {
        return ruleSet.evaluate(new RuleContext(snapshot, durations.build(snapshot), CaseClock.of(snapshot, now)));
    }

    private static List<String> ids(List<Recommendation> recommendations) {
        return recommendations.stream().map(Recommendation::id).collect(Collectors.toList());
    }

    private ReferralSnapshot.Builder assigned(PipelineStatus status, Instant statusLastUpdated) {
        return ReferralSnapshot.builder("r-1")
            .createdAt(created)
            .origin(ReferralOrigin.MC)
            .agentAssigned(true)
            .status(status)
            .statusLastUpdated(statusLastUpdated);
    }

    @Test
    void test_supports_standard_origins_only() {
        assertTrue(ruleSet.supports(ReferralOrigin.MC));
        assertTrue(ruleSet.supports(ReferralOrigin.ADMIN));
        assertFalse(ruleSet.supports(ReferralOrigin.AGENT));
    }

    @Test
    void test_unassigned_case_gets_exactly_one_urgent() {
        ReferralSnapshot snapshot = ReferralSnapshot.builder("r-1")
            .createdAt(created)
            .statusLastUpdated(created)
            .build();

        List<Recommendation> result = evaluate(snapshot, created.plus(Duration.ofHours(3)));

        List<Recommendation> urgent = result.stream()
            .filter(r -> r.priority() == RecommendationPriority.URGENT)
            .collect(Collectors.toList());
        assertEquals(1, urgent.size());
        assertEquals("assign-agent", urgent.get(0).id());
        assertEquals(RecommendationCategory.ASSIGNMENT, urgent.get(0).category());
        assertEquals(created.plus(Duration.ofHours(2)), urgent.get(0).dueAt());
        assertEquals("Assignment SLA: 2h", urgent.get(0).supportingMetric());
        assertFalse(ids(result).contains("coach-initial-outreach"), "Coaching requires an assigned agent");
    }

    @Test
    void test_new_lead_past_assignment_window_needs_coaching() {
        ReferralSnapshot snapshot = assigned(PipelineStatus.NEW_LEAD, created).build();

        List<Recommendation> late = evaluate(snapshot, created.plus(Duration.ofMinutes(121)));
        assertEquals(List.of("coach-initial-outreach"), ids(late));
        assertEquals(RecommendationPriority.HIGH, late.get(0).priority());
        assertEquals("Current lead-to-pairing: Pending", late.get(0).supportingMetric());

        assertTrue(evaluate(snapshot, created.plus(Duration.ofMinutes(90))).isEmpty());
    }

    @Test
    void test_paired_without_conversation() {
        Instant pairedAt = denver("2025-06-02T10:00");
        ReferralSnapshot snapshot = assigned(PipelineStatus.PAIRED, pairedAt).build();

        List<Recommendation> stale = evaluate(snapshot, pairedAt.plus(Duration.ofHours(25)));
        assertEquals(List.of("nudge-first-conversation", "log-communication-update"), ids(stale));
        assertEquals(pairedAt.plus(Duration.ofHours(24)), stale.get(0).dueAt());
        assertEquals("Hours since paired: 25", stale.get(0).supportingMetric());
        assertNull(stale.get(1).dueAt());

        List<Recommendation> fresh = evaluate(snapshot, pairedAt.plus(Duration.ofHours(2)));
        assertEquals(List.of("log-communication-update"), ids(fresh));
    }

    @Test
    void test_paired_with_logged_communication_needs_nothing_extra() {
        ReferralSnapshot snapshot = assigned(PipelineStatus.PAIRED, denver("2025-06-02T10:00"))
            .statusChange(PipelineStatus.PAIRED, denver("2025-06-02T10:00"))
            .statusChange(PipelineStatus.IN_COMMUNICATION, denver("2025-06-02T11:00"))
            .build();

        assertTrue(evaluate(snapshot, denver("2025-06-02T12:00")).isEmpty());
    }

    @Test
    void test_communicating_stalled_touchpoint_and_stale_notes() {
        Instant since = denver("2025-06-02T10:00");
        ReferralSnapshot snapshot = assigned(PipelineStatus.IN_COMMUNICATION, since)
            .note(new Note(denver("2025-06-03T10:00")))
            .build();

        List<Recommendation> result = evaluate(snapshot, since.plus(Duration.ofDays(4)));
        assertEquals(List.of("schedule-proactive-check-in", "refresh-activity-log"), ids(result));
        assertEquals(RecommendationPriority.MEDIUM, result.get(0).priority());
        assertEquals("4 days in current stage", result.get(0).supportingMetric());
        assertEquals(RecommendationPriority.LOW, result.get(1).priority());
        assertEquals("Last note 72h ago", result.get(1).supportingMetric());
    }

    @Test
    void test_communicating_without_contract_for_two_weeks() {
        Instant since = denver("2025-06-02T10:00");
        ReferralSnapshot snapshot = assigned(PipelineStatus.SHOWING_HOMES, since).build();

        List<Recommendation> result = evaluate(snapshot, since.plus(Duration.ofDays(15)));
        assertEquals(List.of("schedule-proactive-check-in", "review-conversion-plan"), ids(result));
        assertEquals(since.plus(Duration.ofDays(14)), result.get(1).dueAt());
    }

    @Test
    void test_days_in_status_override_is_respected() {
        Instant since = denver("2025-06-02T10:00");
        ReferralSnapshot snapshot = assigned(PipelineStatus.IN_COMMUNICATION, since)
            .daysInStatus(5)
            .build();

        assertEquals(List.of("schedule-proactive-check-in"), ids(evaluate(snapshot, since.plus(Duration.ofHours(1)))));
    }

    @Test
    void test_under_contract_without_closing() {
        Instant since = denver("2025-06-02T10:00");
        ReferralSnapshot snapshot = assigned(PipelineStatus.UNDER_CONTRACT, since).build();

        List<Recommendation> result = evaluate(snapshot, since.plus(Duration.ofDays(46)));
        assertEquals(List.of("check-escrow-milestones"), ids(result));
        assertEquals(RecommendationPriority.HIGH, result.get(0).priority());

        assertTrue(evaluate(snapshot, since.plus(Duration.ofDays(30))).isEmpty());
    }

    @Test
    void test_under_contract_with_stored_close_duration_is_quiet() {
        Instant since = denver("2025-06-02T10:00");
        ReferralSnapshot snapshot = assigned(PipelineStatus.UNDER_CONTRACT, since)
            .sla(new SlaCarryForward(900L, null, null, null))
            .build();

        assertTrue(evaluate(snapshot, since.plus(Duration.ofDays(46))).isEmpty());
    }

    @Test
    void test_closed_without_payment() {
        Instant since = denver("2025-06-02T10:00");
        ReferralSnapshot snapshot = assigned(PipelineStatus.CLOSED, since).build();

        List<Recommendation> result = evaluate(snapshot, since.plus(Duration.ofDays(11)));
        assertEquals(List.of("confirm-referral-fee"), ids(result));
        assertEquals(RecommendationCategory.FINANCE, result.get(0).category());

        assertTrue(evaluate(snapshot, since.plus(Duration.ofDays(5))).isEmpty());
    }

    @Test
    void test_terminated_without_documented_reason() {
        Instant since = denver("2025-06-02T10:00");
        ReferralSnapshot undocumented = assigned(PipelineStatus.TERMINATED, since)
            .note(new Note(denver("2025-06-01T10:00")))
            .build();
        assertEquals(List.of("capture-termination-reason"),
            ids(evaluate(undocumented, since.plus(Duration.ofHours(30)))));
        assertTrue(evaluate(undocumented, since.plus(Duration.ofHours(10))).isEmpty());

        ReferralSnapshot documented = assigned(PipelineStatus.LOST, since)
            .note(new Note(since.plus(Duration.ofHours(1))))
            .build();
        assertTrue(evaluate(documented, since.plus(Duration.ofHours(30))).isEmpty());
    }
}
