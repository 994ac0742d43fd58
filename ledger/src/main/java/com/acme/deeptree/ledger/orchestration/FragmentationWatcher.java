package com.acme.deeptree.ledger.orchestration;

import com.acme.deeptree.ledger.memory.AllocationLedger;
import com.acme.deeptree.ledger.memory.LedgerTerminatedException;
import com.acme.deeptree.ledger.telemetry.LedgerEvent;
import com.acme.deeptree.ledger.telemetry.LedgerEventListener;
import com.acme.deeptree.ledger.telemetry.LedgerStats;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Compacts the ledger after a liveness sweep when fragmentation exceeds a threshold.
 */
public final class FragmentationWatcher implements LedgerEventListener {
    private static final Logger LOG = Logger.getLogger(FragmentationWatcher.class.getName());

    private final AllocationLedger ledger;
    private final double triggerRatio;

    public FragmentationWatcher(AllocationLedger ledger, double triggerRatio) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        if (triggerRatio < 0.0d || triggerRatio > 1.0d) {
            throw new IllegalArgumentException("triggerRatio must be within [0, 1], got " + triggerRatio);
        }
        this.triggerRatio = triggerRatio;
    }

    @Override
    public void onEvent(LedgerEvent event) {
        if (!(event instanceof LedgerEvent.SweepComplete)) {
            return;
        }
        try {
            LedgerStats stats = ledger.getStats();
            if (stats.fragmentationRatio() > triggerRatio) {
                LOG.fine(() -> "Fragmentation " + stats.fragmentationRatio() + " above " + triggerRatio
                    + ", requesting defragmentation");
                ledger.defragment();
            }
        } catch (LedgerTerminatedException e) {
            LOG.fine("Skipping defragmentation: ledger destroyed");
        }
    }

    public double triggerRatio() {
        return triggerRatio;
    }
}
