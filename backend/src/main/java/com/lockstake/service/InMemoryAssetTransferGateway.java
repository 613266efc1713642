package com.lockstake.service;

import com.lockstake.config.LockstakeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process asset book: free balances per account plus a single pool balance
 * holding staked principal and the reward reserve.
 */
@Component
public class InMemoryAssetTransferGateway implements AssetTransferGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAssetTransferGateway.class);

    private final Map<String, Long> balances = new ConcurrentHashMap<>();
    private long poolBalance;

    public InMemoryAssetTransferGateway(LockstakeProperties lockstakeProperties) {
        this.poolBalance = lockstakeProperties.getTransfer().getInitialPoolBalance();
    }

    @Override
    public synchronized boolean pullFrom(String account, long amount) {
        Objects.requireNonNull(account, "account is required");
        if (amount <= 0) {
            log.warn("Refused pull of non-positive amount {} from {}", amount, account);
            return false;
        }
        long balance = balanceOf(account);
        if (balance < amount) {
            log.warn("Refused pull of {} from {}: balance {}", amount, account, balance);
            return false;
        }
        balances.put(account, balance - amount);
        poolBalance = Math.addExact(poolBalance, amount);
        log.debug("Pulled {} from {} into pool, pool balance: {}", amount, account, poolBalance);
        return true;
    }

    @Override
    public synchronized boolean pushTo(String account, long amount) {
        Objects.requireNonNull(account, "account is required");
        if (amount <= 0) {
            log.warn("Refused push of non-positive amount {} to {}", amount, account);
            return false;
        }
        if (poolBalance < amount) {
            log.warn("Refused push of {} to {}: pool balance {}", amount, account, poolBalance);
            return false;
        }
        poolBalance -= amount;
        balances.merge(account, amount, Math::addExact);
        log.debug("Pushed {} from pool to {}, pool balance: {}", amount, account, poolBalance);
        return true;
    }

    /**
     * Credits free balance to an account, e.g. an incoming deposit.
     */
    public synchronized void deposit(String account, long amount) {
        Objects.requireNonNull(account, "account is required");
        if (amount <= 0) {
            throw new IllegalArgumentException("Deposit amount must be positive");
        }
        balances.merge(account, amount, Math::addExact);
        log.info("Deposited {} to {}", amount, account);
    }

    /**
     * Adds to the reward reserve held by the pool.
     */
    public synchronized void fundPool(long amount, String source) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Funding amount must be positive");
        }
        poolBalance = Math.addExact(poolBalance, amount);
        log.info("Added {} to pool from {}, new balance: {}", amount, source, poolBalance);
    }

    public long balanceOf(String account) {
        return balances.getOrDefault(account, 0L);
    }

    public synchronized long poolBalance() {
        return poolBalance;
    }
}
