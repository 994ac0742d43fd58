package com.acme.deeptree.ledger.memory;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic millisecond clock used for access times and idleness.
 */
@FunctionalInterface
public interface LedgerClock {
    long nowMillis();

    static LedgerClock monotonic() {
        return () -> TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }
}
