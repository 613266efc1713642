package com.lockstake.service;

import com.lockstake.model.StakeRecord;
import com.lockstake.repository.StakeRecordRepository;
import com.lockstake.repository.StakerRosterRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Aggregate reporting over the staker roster and the record table.
 */
@Service
@RequiredArgsConstructor
public class PoolStatisticsService {

    private final StakerRosterRepository stakerRosterRepository;
    private final StakeRecordRepository stakeRecordRepository;
    private final RewardScheduleService rewardScheduleService;

    /**
     * Historical count: every successful stake adds one, unstaking never removes.
     */
    public int participantCount() {
        return stakerRosterRepository.count();
    }

    public int activeParticipantCount() {
        return stakeRecordRepository.findAllActive().size();
    }

    /**
     * Principal currently locked by accounts in the roster. Each account is read once,
     * however many times it appears in the roster.
     */
    public long poolTotal() {
        Set<String> accounts = new LinkedHashSet<>(stakerRosterRepository.findAll());
        long total = 0L;
        for (String account : accounts) {
            StakeRecord record = stakeRecordRepository.findByAccount(account);
            if (record.isActive()) {
                total = Math.addExact(total, record.getPrincipal());
            }
        }
        return total;
    }

    /**
     * Daily reward a stake of {@code principal} would earn under the given schedule.
     * Disabled schedules still quote.
     */
    public long estimateDailyRate(long principal, int scheduleIndex) {
        return RewardAccrual.dailyRate(principal, rewardScheduleService.get(scheduleIndex));
    }
}
