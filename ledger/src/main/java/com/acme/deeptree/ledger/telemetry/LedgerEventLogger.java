package com.acme.deeptree.ledger.telemetry;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes every ledger event to the log at FINE.
 */
public final class LedgerEventLogger implements LedgerEventListener {
    private static final Logger LOG = Logger.getLogger(LedgerEventLogger.class.getName());

    @Override
    public void onEvent(LedgerEvent event) {
        if (!LOG.isLoggable(Level.FINE)) {
            return;
        }
        LOG.fine(describe(event));
    }

    static String describe(LedgerEvent event) {
        if (event instanceof LedgerEvent.Allocated e) {
            return "Ledger allocated " + e.sizeBytes() + " bytes for " + e.id();
        }
        if (event instanceof LedgerEvent.Freed e) {
            return "Ledger evicted " + e.sizeBytes() + " bytes from " + e.id();
        }
        if (event instanceof LedgerEvent.Released e) {
            return "Ledger released " + e.sizeBytes() + " bytes from " + e.id();
        }
        if (event instanceof LedgerEvent.Reclaimed e) {
            return "Ledger reclaimed " + e.sizeBytes() + " bytes from collected " + e.id();
        }
        if (event instanceof LedgerEvent.AllocationFailed e) {
            return "Ledger allocation failed for " + e.id() + " (" + e.sizeBytes() + " bytes, reasonCode=" + e.reasonCode() + ")";
        }
        if (event instanceof LedgerEvent.SweepComplete e) {
            return "Liveness sweep completed: " + e.freedBytes() + " bytes freed";
        }
        if (event instanceof LedgerEvent.DefragmentComplete e) {
            return "Defragmentation completed: " + e.stats();
        }
        return "Ledger destroyed";
    }
}
