package com.acme.deeptree.ledger.memory;

/**
 * Base class for ledger failures.
 * Carries a reason code from {@link com.acme.deeptree.ledger.util.LedgerStatusCodes} so an
 * orchestrator can map it to its own status without inspecting the concrete type.
 */
public abstract class LedgerException extends RuntimeException {
    private final int reasonCode;

    protected LedgerException(String message, int reasonCode) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public int reasonCode() {
        return reasonCode;
    }
}
