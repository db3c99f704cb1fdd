package com.slapulse.model;

/**
 * Lifecycle status of one deal attempt, in lifecycle order.
 */
public enum DealStatus {
    UNDER_CONTRACT("under_contract"),
    PAST_INSPECTION("past_inspection"),
    PAST_APPRAISAL("past_appraisal"),
    CLEAR_TO_CLOSE("clear_to_close"),
    CLOSED("closed"),
    PAYMENT_SENT("payment_sent"),
    PAID("paid"),
    TERMINATED("terminated");

    private final String value;

    DealStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Every status except a terminated deal counts as contract progress.
     */
    public boolean isPostContract() {
        return this != TERMINATED;
    }

    public boolean isClosedOrLater() {
        return this == CLOSED || this == PAYMENT_SENT || this == PAID;
    }

    public static DealStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DealStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        return null;
    }
}
