package com.lockstake.model;

/**
 * Read-only view of an account's position as of a single clock reading.
 */
public record StakeInfo(
        StakeRecord record,
        long accruedReward,
        long secondsUntilMaturity,
        boolean matured
) {
}
