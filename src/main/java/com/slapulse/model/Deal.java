package com.slapulse.model;

import java.time.Instant;

/**
 * One attempt at carrying a referral from contract to payout.
 *
 * The status is kept as stored so that unsupported values survive mapping;
 * {@link #dealStatus()} returns null for them.
 */
public record Deal(String status, Instant createdAt, Instant updatedAt, Instant paidAt) {

    public DealStatus dealStatus() {
        return DealStatus.fromValue(status);
    }
}
