package com.lockstake.repository;

import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryStakerRosterRepository implements StakerRosterRepository {

    private final List<String> roster = new CopyOnWriteArrayList<>();

    @Override
    public void append(String account) {
        roster.add(Objects.requireNonNull(account, "account is required"));
    }

    @Override
    public int count() {
        return roster.size();
    }

    @Override
    public List<String> findAll() {
        return List.copyOf(roster);
    }
}
