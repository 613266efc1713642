package com.lockstake.service;

/**
 * Authorization check for catalog changes, applied at the start of each privileged call.
 */
public interface OperatorAccessGuard {

    /**
     * @throws com.lockstake.exception.StakingException with code UNAUTHORIZED if {@code caller}
     *         is not the operator
     */
    void requireOperator(String caller);
}
