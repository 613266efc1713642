package com.lockstake.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Epoch-second clock over {@link Clock}. A wall clock stepping backwards is
 * clamped to the last value handed out.
 */
@Component
public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;
    private final AtomicLong lastReading = new AtomicLong(Long.MIN_VALUE);

    public SystemLedgerClock() {
        this(Clock.systemUTC());
    }

    SystemLedgerClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long now() {
        long reading = clock.instant().getEpochSecond();
        return lastReading.accumulateAndGet(reading, Math::max);
    }
}
