package com.lockstake.model;

/**
 * One catalog entry. Its identity is its catalog index, so the value itself is
 * replaced rather than edited when the percentage changes or it is disabled.
 */
public record RewardSchedule(
        int lockDays,
        long lockSeconds,
        int percentage,
        boolean enabled
) {

    public static final long SECONDS_PER_DAY = 86_400L;

    public RewardSchedule {
        if (lockDays <= 0) {
            throw new IllegalArgumentException("lockDays must be positive");
        }
        if (percentage < 0) {
            throw new IllegalArgumentException("percentage must be non-negative");
        }
        if (lockSeconds != lockSecondsFor(lockDays)) {
            throw new IllegalArgumentException(
                    "lockSeconds must equal lockDays * " + SECONDS_PER_DAY + ", got " + lockSeconds);
        }
    }

    public static RewardSchedule of(int lockDays, int percentage) {
        return new RewardSchedule(lockDays, lockSecondsFor(lockDays), percentage, true);
    }

    public static long lockSecondsFor(int lockDays) {
        return Math.multiplyExact((long) lockDays, SECONDS_PER_DAY);
    }

    public RewardSchedule withPercentage(int newPercentage) {
        return new RewardSchedule(lockDays, lockSeconds, newPercentage, enabled);
    }

    public RewardSchedule disabled() {
        return new RewardSchedule(lockDays, lockSeconds, percentage, false);
    }
}
