package com.slapulse.model;

/**
 * Elapsed business time for one milestone pair.
 *
 * A duration is either known, or pending. A pending duration may carry the
 * value the previous cycle reached before it fell through.
 */
public sealed interface DurationValue
    permits DurationValue.Known, DurationValue.PendingWithHistory, DurationValue.PendingNoHistory {

    /**
     * Minutes when known, null while pending.
     */
    Long minutes();

    boolean isPending();

    /**
     * Negative inputs are treated as absent.
     */
    static DurationValue of(Long minutes, Long previousMinutes) {
        if (minutes != null && minutes >= 0) {
            return new Known(minutes);
        }
        if (previousMinutes != null && previousMinutes >= 0) {
            return new PendingWithHistory(previousMinutes);
        }
        return PendingNoHistory.INSTANCE;
    }

    record Known(long value) implements DurationValue {
        public Known {
            if (value < 0) {
                throw new IllegalArgumentException("duration minutes must not be negative: " + value);
            }
        }

        @Override
        public Long minutes() {
            return value;
        }

        @Override
        public boolean isPending() {
            return false;
        }
    }

    record PendingWithHistory(long previousMinutes) implements DurationValue {
        @Override
        public Long minutes() {
            return null;
        }

        @Override
        public boolean isPending() {
            return true;
        }
    }

    final class PendingNoHistory implements DurationValue {
        static final PendingNoHistory INSTANCE = new PendingNoHistory();

        private PendingNoHistory() {
        }

        @Override
        public Long minutes() {
            return null;
        }

        @Override
        public boolean isPending() {
            return true;
        }

        @Override
        public String toString() {
            return "PendingNoHistory";
        }
    }
}
