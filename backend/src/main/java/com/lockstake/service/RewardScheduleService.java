package com.lockstake.service;

import com.lockstake.config.LockstakeProperties;
import com.lockstake.exception.StakingException;
import com.lockstake.model.RewardSchedule;
import com.lockstake.repository.RewardScheduleRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Catalog of reward schedules. Entries are appended or edited in place, never
 * removed; a schedule's index is its permanent identifier.
 */
@Service
@RequiredArgsConstructor
public class RewardScheduleService {

    private static final Logger log = LoggerFactory.getLogger(RewardScheduleService.class);

    private final RewardScheduleRepository rewardScheduleRepository;
    private final OperatorAccessGuard operatorAccessGuard;
    private final LockstakeProperties lockstakeProperties;

    /**
     * Seeds the configured default schedules into an empty catalog.
     *
     * @return number of schedules seeded, 0 if the catalog already had entries
     */
    public int initialize() {
        if (rewardScheduleRepository.count() > 0) {
            log.debug("Schedule catalog already initialized with {} entries", rewardScheduleRepository.count());
            return 0;
        }

        List<RewardSchedule> seeds = lockstakeProperties.getDefaultSchedules().stream()
                .map(seed -> toSchedule(seed.getLockDays(), seed.getPercentage()))
                .toList();
        for (RewardSchedule schedule : seeds) {
            int index = rewardScheduleRepository.append(schedule);
            log.info("Seeded schedule {}: lockDays={}, percentage={}",
                    index, schedule.lockDays(), schedule.percentage());
        }
        return seeds.size();
    }

    /**
     * Sets the percentage of the first schedule with {@code lockDays}, enabled or not,
     * or appends a new enabled schedule when none matches.
     *
     * @return index of the updated or appended schedule
     */
    public int upsert(String caller, int lockDays, int percentage) {
        operatorAccessGuard.requireOperator(caller);
        RewardSchedule candidate = toSchedule(lockDays, percentage);

        List<RewardSchedule> schedules = rewardScheduleRepository.findAll();
        for (int index = 0; index < schedules.size(); index++) {
            RewardSchedule existing = schedules.get(index);
            if (existing.lockDays() == lockDays) {
                rewardScheduleRepository.replace(index, existing.withPercentage(percentage));
                log.info("Updated schedule {}: lockDays={}, percentage {} -> {}",
                        index, lockDays, existing.percentage(), percentage);
                return index;
            }
        }

        int index = rewardScheduleRepository.append(candidate);
        log.info("Added schedule {}: lockDays={}, percentage={}", index, lockDays, percentage);
        return index;
    }

    public void disable(String caller, int index) {
        operatorAccessGuard.requireOperator(caller);
        RewardSchedule schedule = rewardScheduleRepository.findByIndex(index)
                .orElseThrow(() -> StakingException.invalidState(
                        "Cannot disable schedule " + index + ": no such schedule"));
        if (!schedule.enabled()) {
            throw StakingException.invalidState("Schedule " + index + " is already disabled");
        }

        rewardScheduleRepository.replace(index, schedule.disabled());
        log.info("Disabled schedule {}: lockDays={}, percentage={}",
                index, schedule.lockDays(), schedule.percentage());
    }

    public RewardSchedule get(int index) {
        return rewardScheduleRepository.findByIndex(index)
                .orElseThrow(() -> StakingException.indexOutOfRange(index, rewardScheduleRepository.count()));
    }

    /**
     * Resolves a schedule a new lock may be taken against.
     */
    public RewardSchedule requireEnabled(int index) {
        RewardSchedule schedule = get(index);
        if (!schedule.enabled()) {
            throw StakingException.scheduleDisabled(index);
        }
        return schedule;
    }

    public List<RewardSchedule> list() {
        return rewardScheduleRepository.findAll();
    }

    public long catalogVersion() {
        return rewardScheduleRepository.version();
    }

    private static RewardSchedule toSchedule(int lockDays, int percentage) {
        if (lockDays <= 0) {
            throw StakingException.invalidScheduleParameters("lockDays must be positive, got " + lockDays);
        }
        if (percentage < 0) {
            throw StakingException.invalidScheduleParameters("percentage must be non-negative, got " + percentage);
        }
        return RewardSchedule.of(lockDays, percentage);
    }
}
