package com.slapulse.model;

/**
 * The fixed milestone-to-milestone chain, in display order.
 */
public enum DurationKey {
    NEW_LEAD_TO_PAIRED("new-lead-to-paired", "New Lead → Paired"),
    PAIRED_TO_COMMUNICATION("paired-to-communication", "Paired → Communicating"),
    COMMUNICATION_TO_CONTRACT("communication-to-contract", "Communicating → Under Contract"),
    CONTRACT_TO_CLOSE("contract-to-close", "Deal: Under Contract → Closed"),
    CLOSE_TO_PAID("close-to-paid", "Deal: Closed → Paid");

    private final String key;
    private final String label;

    DurationKey(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }
}
