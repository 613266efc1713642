package com.lockstake.exception;

import lombok.Getter;

/**
 * Raised when a ledger or catalog operation is rejected. The operation that
 * threw has left no state change behind.
 */
@Getter
public class StakingException extends RuntimeException {

    private final StakingErrorCode code;

    public StakingException(StakingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public StakingException(StakingErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static StakingException alreadyStaking(String account) {
        return new StakingException(
                StakingErrorCode.ALREADY_STAKING,
                "Account already has an active stake: " + account
        );
    }

    public static StakingException invalidAmount(long amount) {
        return new StakingException(
                StakingErrorCode.INVALID_AMOUNT,
                "Stake amount must be positive, got " + amount
        );
    }

    public static StakingException indexOutOfRange(int index, int size) {
        return new StakingException(
                StakingErrorCode.INDEX_OUT_OF_RANGE,
                "Schedule index " + index + " out of range [0, " + size + ")"
        );
    }

    public static StakingException scheduleDisabled(int index) {
        return new StakingException(
                StakingErrorCode.SCHEDULE_DISABLED,
                "Schedule " + index + " is disabled"
        );
    }

    public static StakingException notStaking(String account) {
        return new StakingException(
                StakingErrorCode.NOT_STAKING,
                "Account has no active stake: " + account
        );
    }

    public static StakingException lockNotMatured(String account, long maturityTime) {
        return new StakingException(
                StakingErrorCode.LOCK_NOT_MATURED,
                "Stake for " + account + " is locked until " + maturityTime
        );
    }

    public static StakingException lockMatured(String account, long maturityTime) {
        return new StakingException(
                StakingErrorCode.LOCK_MATURED,
                "Stake for " + account + " matured at " + maturityTime + "; unstake or restake instead"
        );
    }

    public static StakingException noRewardAvailable(String account) {
        return new StakingException(
                StakingErrorCode.NO_REWARD_AVAILABLE,
                "No full day of reward has accrued for " + account
        );
    }

    public static StakingException unauthorized(String caller) {
        return new StakingException(
                StakingErrorCode.UNAUTHORIZED,
                "Caller is not the ledger operator: " + caller
        );
    }

    public static StakingException transferFailed(String detail) {
        return new StakingException(StakingErrorCode.TRANSFER_FAILED, detail);
    }

    public static StakingException transferFailed(String detail, Throwable cause) {
        return new StakingException(StakingErrorCode.TRANSFER_FAILED, detail, cause);
    }

    public static StakingException invalidState(String detail) {
        return new StakingException(StakingErrorCode.INVALID_STATE, detail);
    }

    public static StakingException invalidScheduleParameters(String detail) {
        return new StakingException(StakingErrorCode.INVALID_SCHEDULE_PARAMETERS, detail);
    }

    public static StakingException reentrantCall(String account) {
        return new StakingException(
                StakingErrorCode.REENTRANT_CALL,
                "Ledger operation already in progress for " + account
        );
    }
}
