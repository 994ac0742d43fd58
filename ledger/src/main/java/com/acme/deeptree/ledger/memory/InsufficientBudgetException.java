package com.acme.deeptree.ledger.memory;

import com.acme.deeptree.ledger.util.LedgerStatusCodes;

/**
 * Thrown when a request cannot be charged against the budget even after eviction.
 * Records already evicted while trying stay evicted.
 */
public final class InsufficientBudgetException extends LedgerException {
    private final String id;
    private final long requestedBytes;
    private final long freedBytes;

    public InsufficientBudgetException(String id, long requestedBytes, long freedBytes) {
        super("Insufficient budget for '" + id + "': requested=" + requestedBytes + " freed=" + freedBytes,
            LedgerStatusCodes.INSUFFICIENT_STORAGE);
        this.id = id;
        this.requestedBytes = requestedBytes;
        this.freedBytes = freedBytes;
    }

    /** Eviction walk that fell short, not tied to a particular allocation. */
    public InsufficientBudgetException(long requestedBytes, long freedBytes) {
        super("Could not free enough budget: required=" + requestedBytes + " freed=" + freedBytes,
            LedgerStatusCodes.INSUFFICIENT_STORAGE);
        this.id = null;
        this.requestedBytes = requestedBytes;
        this.freedBytes = freedBytes;
    }

    /** Id of the allocation that failed, or {@code null} for a bare eviction walk. */
    public String id() {
        return id;
    }

    public long requestedBytes() {
        return requestedBytes;
    }

    public long freedBytes() {
        return freedBytes;
    }
}
