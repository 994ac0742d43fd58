package com.acme.deeptree.ledger.telemetry;

/**
 * Counters derived from the ledger event stream. Subscribe an implementation to a ledger
 * to feed it.
 */
public interface LedgerMetrics extends LedgerEventListener {
    void incAllocations(long bytes);
    void incEvictions(long bytes);
    void incReleases(long bytes);
    void incReclamations(long bytes);
    void incAllocationFailures(int reasonCode);
    void incSweeps(long freedBytes);
    void incDefragmentations();

    @Override
    default void onEvent(LedgerEvent event) {
        if (event instanceof LedgerEvent.Allocated allocated) {
            incAllocations(allocated.sizeBytes());
        } else if (event instanceof LedgerEvent.Freed freed) {
            incEvictions(freed.sizeBytes());
        } else if (event instanceof LedgerEvent.Released released) {
            incReleases(released.sizeBytes());
        } else if (event instanceof LedgerEvent.Reclaimed reclaimed) {
            incReclamations(reclaimed.sizeBytes());
        } else if (event instanceof LedgerEvent.AllocationFailed failed) {
            incAllocationFailures(failed.reasonCode());
        } else if (event instanceof LedgerEvent.SweepComplete sweep) {
            incSweeps(sweep.freedBytes());
        } else if (event instanceof LedgerEvent.DefragmentComplete) {
            incDefragmentations();
        }
    }
}
