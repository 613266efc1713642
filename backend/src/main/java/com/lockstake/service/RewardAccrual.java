package com.lockstake.service;

import com.lockstake.model.RewardSchedule;
import com.lockstake.model.StakeRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Reward arithmetic for time-locked stakes. All divisions truncate toward zero.
 *
 * <p>The daily rate divides twice: the percentage cut of the principal is truncated
 * first, and that truncated amount is then split across the lock days.
 */
public final class RewardAccrual {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private RewardAccrual() {
    }

    public static long dailyRate(long principal, int lockDays, int percentage) {
        if (lockDays <= 0) {
            throw new IllegalArgumentException("lockDays must be positive");
        }
        if (principal < 0 || percentage < 0) {
            throw new IllegalArgumentException("principal and percentage must be non-negative");
        }
        // principal * percentage may exceed a long even when the rate does not
        BigDecimal totalReward = BigDecimal.valueOf(principal)
                .multiply(BigDecimal.valueOf(percentage))
                .divide(ONE_HUNDRED, 0, RoundingMode.DOWN);
        return totalReward
                .divide(BigDecimal.valueOf(lockDays), 0, RoundingMode.DOWN)
                .longValueExact();
    }

    public static long dailyRate(long principal, RewardSchedule schedule) {
        return dailyRate(principal, schedule.lockDays(), schedule.percentage());
    }

    public static long elapsedDays(long lastClaimTime, long now) {
        if (now <= lastClaimTime) {
            return 0L;
        }
        return (now - lastClaimTime) / RewardSchedule.SECONDS_PER_DAY;
    }

    /**
     * Reward claimable at {@code now}: whole days since the last claim times the daily rate.
     * Zero for an inactive record or once the lock has matured.
     */
    public static long accruedReward(StakeRecord record, long now) {
        if (!record.isActive() || record.isMatured(now)) {
            return 0L;
        }
        long days = elapsedDays(record.getLastClaimTime(), now);
        if (days == 0L) {
            return 0L;
        }
        long rate = dailyRate(record.getPrincipal(), record.getLockDays(), record.getPercentage());
        return Math.multiplyExact(days, rate);
    }
}
