package com.lockstake.service;

import com.lockstake.exception.StakingException;
import com.lockstake.model.RewardSchedule;
import com.lockstake.model.StakeInfo;
import com.lockstake.model.StakeRecord;
import com.lockstake.repository.StakeRecordRepository;
import com.lockstake.repository.StakerRosterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Per-account staking state machine: Inactive -> stake -> Active -> unstake -> Inactive,
 * with restake and claimReward keeping the record Active.
 *
 * <p>Every operation reads the clock once, validates before mutating, and writes the
 * record before calling the transfer gateway. A refused or failing transfer restores
 * the previous record. Callers are expected to serialize access to the ledger.
 */
@Service
public class StakeLedgerService {

    private static final Logger log = LoggerFactory.getLogger(StakeLedgerService.class);

    private final StakeRecordRepository stakeRecordRepository;
    private final StakerRosterRepository stakerRosterRepository;
    private final RewardScheduleService rewardScheduleService;
    private final AssetTransferGateway assetTransferGateway;
    private final LedgerClock ledgerClock;

    // accounts with a transfer outstanding
    private final Set<String> inFlightAccounts = ConcurrentHashMap.newKeySet();

    public StakeLedgerService(
            StakeRecordRepository stakeRecordRepository,
            StakerRosterRepository stakerRosterRepository,
            RewardScheduleService rewardScheduleService,
            AssetTransferGateway assetTransferGateway,
            LedgerClock ledgerClock
    ) {
        this.stakeRecordRepository = stakeRecordRepository;
        this.stakerRosterRepository = stakerRosterRepository;
        this.rewardScheduleService = rewardScheduleService;
        this.assetTransferGateway = assetTransferGateway;
        this.ledgerClock = ledgerClock;
    }

    /**
     * Locks {@code amount} from {@code account} under the schedule at {@code scheduleIndex}.
     *
     * @return the new active record
     */
    public StakeRecord stake(String account, long amount, int scheduleIndex) {
        String staker = requireAccount(account);
        return guarded(staker, () -> {
            long now = ledgerClock.now();
            StakeRecord current = stakeRecordRepository.findByAccount(staker);
            if (current.isActive()) {
                throw StakingException.alreadyStaking(staker);
            }
            if (amount <= 0) {
                throw StakingException.invalidAmount(amount);
            }
            RewardSchedule schedule = rewardScheduleService.requireEnabled(scheduleIndex);

            StakeRecord staked = StakeRecord.inactive(staker);
            staked.setPrincipal(amount);
            staked.applySchedule(schedule, now);
            stakeRecordRepository.save(staked);

            transferOrRestore(current, () -> assetTransferGateway.pullFrom(staker, amount),
                    "pull of " + amount + " from " + staker);
            stakerRosterRepository.append(staker);

            log.info("Staked {} for {} on schedule {} ({} days, {}%), matures at {}",
                    amount, staker, scheduleIndex, schedule.lockDays(), schedule.percentage(),
                    staked.getMaturityTime());
            return staked.copy();
        });
    }

    /**
     * Returns the principal of a matured stake and clears the record.
     *
     * @return the principal paid back
     */
    public long unstake(String account) {
        String staker = requireAccount(account);
        return guarded(staker, () -> {
            long now = ledgerClock.now();
            StakeRecord current = requireActive(staker);
            if (!current.isMatured(now)) {
                throw StakingException.lockNotMatured(staker, current.getMaturityTime());
            }

            long principal = current.getPrincipal();
            stakeRecordRepository.reset(staker);
            transferOrRestore(current, () -> assetTransferGateway.pushTo(staker, principal),
                    "return of principal " + principal + " to " + staker);

            log.info("Unstaked {} for {} (claimed {} during lock)", principal, staker, current.getTotalClaimed());
            return principal;
        });
    }

    /**
     * Re-locks a matured stake's principal under a new schedule without moving funds.
     *
     * @return the re-parameterized record
     */
    public StakeRecord restake(String account, int scheduleIndex) {
        String staker = requireAccount(account);
        return guarded(staker, () -> {
            long now = ledgerClock.now();
            StakeRecord current = requireActive(staker);
            if (!current.isMatured(now)) {
                throw StakingException.lockNotMatured(staker, current.getMaturityTime());
            }
            RewardSchedule schedule = rewardScheduleService.requireEnabled(scheduleIndex);

            StakeRecord restaked = current.copy();
            restaked.applySchedule(schedule, now);
            stakeRecordRepository.save(restaked);

            log.info("Restaked {} for {} on schedule {} ({} days, {}%), matures at {}",
                    restaked.getPrincipal(), staker, scheduleIndex, schedule.lockDays(), schedule.percentage(),
                    restaked.getMaturityTime());
            return restaked.copy();
        });
    }

    /**
     * Pays out the whole days of reward accrued since the last claim.
     *
     * @return the reward paid
     */
    public long claimReward(String account) {
        String staker = requireAccount(account);
        return guarded(staker, () -> {
            long now = ledgerClock.now();
            StakeRecord current = requireActive(staker);
            if (current.isMatured(now)) {
                throw StakingException.lockMatured(staker, current.getMaturityTime());
            }
            long reward = RewardAccrual.accruedReward(current, now);
            if (reward == 0L) {
                throw StakingException.noRewardAvailable(staker);
            }

            StakeRecord claimed = current.copy();
            claimed.setTotalClaimed(Math.addExact(current.getTotalClaimed(), reward));
            claimed.setLastClaimTime(now);
            stakeRecordRepository.save(claimed);
            transferOrRestore(current, () -> assetTransferGateway.pushTo(staker, reward),
                    "reward payout of " + reward + " to " + staker);

            log.info("Paid reward {} to {}, total claimed {}", reward, staker, claimed.getTotalClaimed());
            return reward;
        });
    }

    public StakeRecord getRecord(String account) {
        return stakeRecordRepository.findByAccount(requireAccount(account));
    }

    public long accruedReward(String account) {
        StakeRecord record = getRecord(account);
        return RewardAccrual.accruedReward(record, ledgerClock.now());
    }

    public StakeInfo stakeInfo(String account) {
        StakeRecord record = getRecord(account);
        long now = ledgerClock.now();
        if (!record.isActive()) {
            return new StakeInfo(record, 0L, 0L, false);
        }
        long secondsUntilMaturity = Math.max(0L, record.getMaturityTime() - now);
        return new StakeInfo(
                record,
                RewardAccrual.accruedReward(record, now),
                secondsUntilMaturity,
                record.isMatured(now)
        );
    }

    private StakeRecord requireActive(String account) {
        StakeRecord current = stakeRecordRepository.findByAccount(account);
        if (!current.isActive()) {
            throw StakingException.notStaking(account);
        }
        return current;
    }

    private void transferOrRestore(StakeRecord previous, BooleanSupplier transfer, String description) {
        boolean transferred;
        try {
            transferred = transfer.getAsBoolean();
        } catch (RuntimeException ex) {
            stakeRecordRepository.save(previous);
            log.warn("Transfer failed: {}", description, ex);
            throw StakingException.transferFailed(description + " failed", ex);
        }
        if (!transferred) {
            stakeRecordRepository.save(previous);
            log.warn("Transfer refused: {}", description);
            throw StakingException.transferFailed(description + " was refused");
        }
    }

    private <T> T guarded(String account, Supplier<T> operation) {
        if (!inFlightAccounts.add(account)) {
            throw StakingException.reentrantCall(account);
        }
        try {
            return operation.get();
        } finally {
            inFlightAccounts.remove(account);
        }
    }

    private static String requireAccount(String account) {
        Objects.requireNonNull(account, "account is required");
        if (account.isBlank()) {
            throw new IllegalArgumentException("account must not be blank");
        }
        return account;
    }
}
