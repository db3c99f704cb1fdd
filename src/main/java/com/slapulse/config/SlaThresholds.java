package com.slapulse.config;

/**
 * Fixed thresholds the recommendation rule sets evaluate against.
 *
 * The first group applies to standard referrals, the last three to
 * agent-originated ones. The note thresholds are shared.
 */
public record SlaThresholds(
    long minutesToAssignment,
    long hoursToFirstConversation,
    long daysWithoutTouchPoint,
    long daysToUnderContract,
    long daysToClose,
    long daysToPaymentAfterClose,
    long hoursWithoutNote,
    long hoursToTerminationReason,
    long hoursToLenderAssignment,
    long hoursToBorrowerIntro,
    long hoursCommunicationStalled
) {

    public SlaThresholds {
        requirePositive("minutesToAssignment", minutesToAssignment);
        requirePositive("hoursToFirstConversation", hoursToFirstConversation);
        requirePositive("daysWithoutTouchPoint", daysWithoutTouchPoint);
        requirePositive("daysToUnderContract", daysToUnderContract);
        requirePositive("daysToClose", daysToClose);
        requirePositive("daysToPaymentAfterClose", daysToPaymentAfterClose);
        requirePositive("hoursWithoutNote", hoursWithoutNote);
        requirePositive("hoursToTerminationReason", hoursToTerminationReason);
        requirePositive("hoursToLenderAssignment", hoursToLenderAssignment);
        requirePositive("hoursToBorrowerIntro", hoursToBorrowerIntro);
        requirePositive("hoursCommunicationStalled", hoursCommunicationStalled);
    }

    public static SlaThresholds defaults() {
        return new SlaThresholds(120, 24, 3, 14, 45, 10, 48, 24, 1, 4, 72);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }
}
