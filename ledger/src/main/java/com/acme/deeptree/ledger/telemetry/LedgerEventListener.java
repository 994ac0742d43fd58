package com.acme.deeptree.ledger.telemetry;

/**
 * Receives ledger events on the thread that completed the operation, after the ledger
 * lock has been released. Listeners may call back into the ledger.
 */
@FunctionalInterface
public interface LedgerEventListener {
    void onEvent(LedgerEvent event);
}
