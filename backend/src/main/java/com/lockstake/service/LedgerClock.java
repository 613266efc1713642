package com.lockstake.service;

/**
 * Source of the ledger's notion of current time, in seconds. Successive readings never decrease.
 */
public interface LedgerClock {

    long now();
}
