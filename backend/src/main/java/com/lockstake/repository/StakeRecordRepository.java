package com.lockstake.repository;

import com.lockstake.model.StakeRecord;

import java.util.List;

/**
 * One row per account. Reads and writes exchange detached copies.
 */
public interface StakeRecordRepository {

    /**
     * @return the stored record, or the inactive sentinel for an unknown account
     */
    StakeRecord findByAccount(String account);

    void save(StakeRecord record);

    /**
     * Replaces the account's row with the inactive sentinel.
     */
    void reset(String account);

    List<StakeRecord> findAllActive();
}
