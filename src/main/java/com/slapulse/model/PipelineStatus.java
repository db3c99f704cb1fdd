package com.slapulse.model;

/**
 * Coarse-grained workflow stage of a referral, in pipeline order.
 *
 * Each value carries the display label the record system stores in the
 * status field and in status audit entries.
 */
public enum PipelineStatus {
    NEW_LEAD("New Lead"),
    PAIRED("Paired"),
    IN_COMMUNICATION("In Communication"),
    SHOWING_HOMES("Showing Homes"),
    UNDER_CONTRACT("Under Contract"),
    PAST_INSPECTION("Past Inspection"),
    PAST_APPRAISAL("Past Appraisal"),
    CLEAR_TO_CLOSE("Clear to Close"),
    CLOSED("Closed"),
    PAYMENT_SENT("Payment Sent"),
    TERMINATED("Terminated"),
    LOST("Lost");

    private final String label;

    PipelineStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns true while no contract has been reached in the current cycle.
     */
    public boolean isPreContract() {
        return this == NEW_LEAD || this == PAIRED || this == IN_COMMUNICATION || this == SHOWING_HOMES;
    }

    /**
     * Returns true once the referral is under contract or past it, up to payment sent.
     */
    public boolean isContracting() {
        return this == UNDER_CONTRACT || this == PAST_INSPECTION || this == PAST_APPRAISAL
            || this == CLEAR_TO_CLOSE || this == CLOSED || this == PAYMENT_SENT;
    }

    public boolean isCommunicating() {
        return this == IN_COMMUNICATION || this == SHOWING_HOMES;
    }

    public boolean isTerminal() {
        return this == TERMINATED || this == LOST;
    }

    /**
     * Resolves a stored label, or null when the label is unknown.
     */
    public static PipelineStatus fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (PipelineStatus status : values()) {
            if (status.label.equals(label)) {
                return status;
            }
        }
        return null;
    }
}
