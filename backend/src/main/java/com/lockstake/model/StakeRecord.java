package com.lockstake.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Staking position of a single account. An account without a live position is
 * represented by the {@link #inactive(String)} sentinel, never by a missing row.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
public class StakeRecord {

    private String account;

    private long principal;

    private long startTime;

    private long maturityTime;

    private long lockSeconds;

    private int lockDays;

    private int percentage;

    private long totalClaimed;

    private long lastClaimTime;

    private boolean active;

    public static StakeRecord inactive(String account) {
        StakeRecord record = new StakeRecord();
        record.setAccount(account);
        return record;
    }

    /**
     * Copies the schedule terms into this record and restarts its clock at {@code now}.
     * Principal is left untouched.
     */
    public void applySchedule(RewardSchedule schedule, long now) {
        this.startTime = now;
        this.maturityTime = Math.addExact(now, schedule.lockSeconds());
        this.lockSeconds = schedule.lockSeconds();
        this.lockDays = schedule.lockDays();
        this.percentage = schedule.percentage();
        this.totalClaimed = 0L;
        this.lastClaimTime = now;
        this.active = true;
    }

    public boolean isMatured(long now) {
        return now >= maturityTime;
    }

    public StakeRecord copy() {
        StakeRecord copy = new StakeRecord();
        copy.setAccount(account);
        copy.setPrincipal(principal);
        copy.setStartTime(startTime);
        copy.setMaturityTime(maturityTime);
        copy.setLockSeconds(lockSeconds);
        copy.setLockDays(lockDays);
        copy.setPercentage(percentage);
        copy.setTotalClaimed(totalClaimed);
        copy.setLastClaimTime(lastClaimTime);
        copy.setActive(active);
        return copy;
    }
}
