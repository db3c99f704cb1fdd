package com.slapulse.model;

/**
 * Minute values the record system stored at the last cycle reset.
 *
 * All components are nullable. The engine only reads these values.
 */
public record SlaCarryForward(
    Long contractToCloseMinutes,
    Long closedToPaidMinutes,
    Long previousContractToCloseMinutes,
    Long previousClosedToPaidMinutes
) {

    private static final SlaCarryForward EMPTY = new SlaCarryForward(null, null, null, null);

    public static SlaCarryForward empty() {
        return EMPTY;
    }
}
