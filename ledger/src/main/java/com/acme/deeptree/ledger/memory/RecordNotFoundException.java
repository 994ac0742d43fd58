package com.acme.deeptree.ledger.memory;

import com.acme.deeptree.ledger.util.LedgerStatusCodes;

public final class RecordNotFoundException extends LedgerException {
    private final String id;

    public RecordNotFoundException(String id) {
        super("No allocation record for '" + id + "'", LedgerStatusCodes.NOT_FOUND);
        this.id = id;
    }

    public String id() {
        return id;
    }
}
