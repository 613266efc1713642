package com.lockstake.repository;

import com.lockstake.model.RewardSchedule;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class InMemoryRewardScheduleRepository implements RewardScheduleRepository {

    private final List<RewardSchedule> schedules = new CopyOnWriteArrayList<>();
    private final AtomicLong version = new AtomicLong();

    @Override
    public int count() {
        return schedules.size();
    }

    @Override
    public Optional<RewardSchedule> findByIndex(int index) {
        if (index < 0 || index >= schedules.size()) {
            return Optional.empty();
        }
        return Optional.of(schedules.get(index));
    }

    @Override
    public List<RewardSchedule> findAll() {
        return List.copyOf(schedules);
    }

    @Override
    public int append(RewardSchedule schedule) {
        schedules.add(Objects.requireNonNull(schedule, "schedule is required"));
        version.incrementAndGet();
        return schedules.size() - 1;
    }

    @Override
    public void replace(int index, RewardSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule is required");
        if (index < 0 || index >= schedules.size()) {
            throw new IndexOutOfBoundsException("No schedule at index " + index);
        }
        schedules.set(index, schedule);
        version.incrementAndGet();
    }

    @Override
    public long version() {
        return version.get();
    }
}
