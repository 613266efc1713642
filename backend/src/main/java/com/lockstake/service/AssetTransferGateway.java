package com.lockstake.service;

/**
 * Moves asset balances between participant accounts and the staking pool.
 * Balance and allowance checks belong to the implementation.
 */
public interface AssetTransferGateway {

    /**
     * Moves {@code amount} from {@code account} into the pool.
     *
     * @return false if the transfer was refused; nothing moved in that case
     */
    boolean pullFrom(String account, long amount);

    /**
     * Moves {@code amount} from the pool to {@code account}.
     *
     * @return false if the transfer was refused; nothing moved in that case
     */
    boolean pushTo(String account, long amount);
}
