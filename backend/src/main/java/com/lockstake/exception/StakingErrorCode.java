package com.lockstake.exception;

public enum StakingErrorCode {
    ALREADY_STAKING,
    INVALID_AMOUNT,
    INDEX_OUT_OF_RANGE,
    SCHEDULE_DISABLED,
    NOT_STAKING,
    LOCK_NOT_MATURED,
    LOCK_MATURED,
    NO_REWARD_AVAILABLE,
    UNAUTHORIZED,
    TRANSFER_FAILED,
    INVALID_STATE,
    INVALID_SCHEDULE_PARAMETERS,
    REENTRANT_CALL
}
