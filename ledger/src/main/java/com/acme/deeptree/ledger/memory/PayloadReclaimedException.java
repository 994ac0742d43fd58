package com.acme.deeptree.ledger.memory;

import com.acme.deeptree.ledger.util.LedgerStatusCodes;

/**
 * The record existed but its payload was destroyed by its owner. Terminal for that id:
 * the record is gone by the time this is thrown.
 */
public final class PayloadReclaimedException extends LedgerException {
    private final String id;

    public PayloadReclaimedException(String id) {
        super("Payload for '" + id + "' has been reclaimed", LedgerStatusCodes.GONE);
        this.id = id;
    }

    public String id() {
        return id;
    }
}
