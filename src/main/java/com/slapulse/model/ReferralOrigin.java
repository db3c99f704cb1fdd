package com.slapulse.model;

/**
 * Workflow variant that created a referral.
 *
 * AGENT referrals are self-originated: a partner agent brought the borrower
 * and the case only needs a mortgage consultant on the receiving side.
 * MC and ADMIN referrals follow the standard pairing workflow.
 */
public enum ReferralOrigin {
    AGENT,
    MC,
    ADMIN;

    public boolean isSelfOriginated() {
        return this == AGENT;
    }

    public static ReferralOrigin fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ReferralOrigin origin : values()) {
            if (origin.name().equalsIgnoreCase(value)) {
                return origin;
            }
        }
        return null;
    }
}
