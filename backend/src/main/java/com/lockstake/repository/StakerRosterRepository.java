package com.lockstake.repository;

import java.util.List;

/**
 * Append-only log of every successful stake, one entry per stake. Accounts that
 * unstake and stake again appear more than once.
 */
public interface StakerRosterRepository {

    void append(String account);

    int count();

    List<String> findAll();
}
