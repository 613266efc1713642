package com.lockstake.repository;

import com.lockstake.model.RewardSchedule;

import java.util.List;
import java.util.Optional;

/**
 * Append-only, index-addressed schedule catalog. Indices are never reused or shifted.
 */
public interface RewardScheduleRepository {

    int count();

    Optional<RewardSchedule> findByIndex(int index);

    List<RewardSchedule> findAll();

    /**
     * @return the index assigned to the appended schedule
     */
    int append(RewardSchedule schedule);

    void replace(int index, RewardSchedule schedule);

    /**
     * Incremented on every append or replace.
     */
    long version();
}
