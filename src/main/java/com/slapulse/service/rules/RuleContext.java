package com.slapulse.service.rules;

import com.slapulse.model.DurationKey;
import com.slapulse.model.PipelineStatus;
import com.slapulse.model.ReferralSnapshot;
import com.slapulse.model.SlaDuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Inputs one rule set evaluates: the snapshot, its durations and its ages.
 */
public final class RuleContext {

    private final ReferralSnapshot snapshot;
    private final Map<DurationKey, SlaDuration> durations = new EnumMap<>(DurationKey.class);
    private final CaseClock clock;

    public RuleContext(ReferralSnapshot snapshot, List<SlaDuration> durations, CaseClock clock) {
        this.snapshot = snapshot;
        this.clock = clock;
        for (SlaDuration duration : durations) {
            this.durations.put(duration.key(), duration);
        }
    }

    public ReferralSnapshot snapshot() {
        return snapshot;
    }

    public PipelineStatus status() {
        return snapshot.status();
    }

    public CaseClock clock() {
        return clock;
    }

    /**
     * Known minutes for a leg, or null when pending or not applicable.
     */
    public Long minutes(DurationKey key) {
        SlaDuration duration = durations.get(key);
        return duration != null ? duration.minutes() : null;
    }
}
