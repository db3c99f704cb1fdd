package com.slapulse.json;

/**
 * Thrown when a referral document cannot be turned into a snapshot at all.
 *
 * Malformed individual values (timestamps, statuses) never raise this; they
 * are mapped to absent values instead.
 */
public class InvalidSnapshotException extends RuntimeException {

    public InvalidSnapshotException(String message) {
        super(message);
    }

    public InvalidSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
