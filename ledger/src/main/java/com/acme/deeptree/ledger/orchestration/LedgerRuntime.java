package com.acme.deeptree.ledger.orchestration;

import com.acme.deeptree.ledger.memory.AllocationLedger;
import com.acme.deeptree.ledger.memory.BudgetedAllocationLedger;
import com.acme.deeptree.ledger.memory.LedgerConfig;
import com.acme.deeptree.ledger.telemetry.AtomicLedgerMetrics;
import com.acme.deeptree.ledger.telemetry.LedgerEventBus;
import com.acme.deeptree.ledger.telemetry.LedgerEventLogger;
import com.acme.deeptree.ledger.telemetry.PeriodicLedgerStatsReporter;
import com.acme.deeptree.ledger.util.LedgerDefaults;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires a ledger with event logging, counters, fragmentation-driven compaction and the
 * periodic stats reporter, and registers the orchestrator's components with it.
 */
public final class LedgerRuntime implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(LedgerRuntime.class.getName());

    private final AllocationLedger ledger;
    private final AtomicLedgerMetrics metrics = new AtomicLedgerMetrics();
    private final JsonPayloadSizeEstimator sizeEstimator = new JsonPayloadSizeEstimator();
    private final List<LedgerEventBus.Subscription> subscriptions = new ArrayList<>();
    private final PeriodicLedgerStatsReporter statsReporter;
    private final AtomicLong batchSeq = new AtomicLong();

    public LedgerRuntime(LedgerConfig config) {
        this(config, new BudgetedAllocationLedger(config));
    }

    public LedgerRuntime(LedgerConfig config, AllocationLedger ledger) {
        Objects.requireNonNull(config, "config");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        subscriptions.add(ledger.subscribe(new LedgerEventLogger()));
        subscriptions.add(ledger.subscribe(metrics));
        subscriptions.add(ledger.subscribe(new FragmentationWatcher(ledger, config.defragTriggerRatio())));
        if (config.statsLogEnabled()) {
            statsReporter = new PeriodicLedgerStatsReporter(ledger::getStats, metrics, config.statsLogIntervalSec());
            statsReporter.start();
        } else {
            statsReporter = null;
        }
    }

    public static LedgerRuntime fromEnv() {
        return new LedgerRuntime(LedgerConfig.fromEnv());
    }

    /**
     * Tracks a component, sized from its JSON rendering.
     *
     * @return the charged size in bytes
     */
    public long registerComponent(String id, Object component, int priorityTier) {
        long size = sizeEstimator.estimateBytes(component);
        ledger.allocate(id, size, component, priorityTier);
        return size;
    }

    /**
     * Tracks a training batch at the default tier under a generated id.
     *
     * @param batch the object owning the matrices; the ledger observes it without keeping it alive
     * @return the generated id
     */
    public String registerTrainingBatch(Object batch, double[][] inputs, double[][] targets) {
        String id = "training_" + batchSeq.incrementAndGet();
        long size = sizeEstimator.estimateTrainingBatchBytes(inputs, targets);
        ledger.allocate(id, size, batch, LedgerDefaults.DEFAULT_PRIORITY_TIER);
        return id;
    }

    public AllocationLedger ledger() {
        return ledger;
    }

    public AtomicLedgerMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        if (statsReporter != null) {
            try {
                statsReporter.close();
            } catch (RuntimeException e) {
                LOG.log(Level.FINE, "Shutdown: stats reporter stop failed", e);
            }
        }
        ledger.close();
        for (LedgerEventBus.Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
    }
}
