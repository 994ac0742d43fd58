package com.acme.deeptree.ledger.memory;

import com.acme.deeptree.ledger.util.LedgerStatusCodes;

public final class LedgerTerminatedException extends LedgerException {

    public LedgerTerminatedException() {
        super("Allocation ledger has been destroyed", LedgerStatusCodes.SERVICE_UNAVAILABLE);
    }
}
