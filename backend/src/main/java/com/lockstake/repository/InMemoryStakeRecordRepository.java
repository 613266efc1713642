package com.lockstake.repository;

import com.lockstake.model.StakeRecord;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryStakeRecordRepository implements StakeRecordRepository {

    private final Map<String, StakeRecord> records = new ConcurrentHashMap<>();

    @Override
    public StakeRecord findByAccount(String account) {
        Objects.requireNonNull(account, "account is required");
        StakeRecord stored = records.get(account);
        return stored == null ? StakeRecord.inactive(account) : stored.copy();
    }

    @Override
    public void save(StakeRecord record) {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(record.getAccount(), "record.account is required");
        records.put(record.getAccount(), record.copy());
    }

    @Override
    public void reset(String account) {
        Objects.requireNonNull(account, "account is required");
        records.put(account, StakeRecord.inactive(account));
    }

    @Override
    public List<StakeRecord> findAllActive() {
        return records.values().stream()
                .filter(StakeRecord::isActive)
                .map(StakeRecord::copy)
                .toList();
    }
}
