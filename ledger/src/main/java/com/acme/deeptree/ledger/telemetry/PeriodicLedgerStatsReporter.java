package com.acme.deeptree.ledger.telemetry;

import com.acme.deeptree.ledger.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs ledger stats and event counters as one JSON line per interval.
 */
public final class PeriodicLedgerStatsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicLedgerStatsReporter.class.getName());

    private final Supplier<LedgerStats> statsSupplier;
    private final AtomicLedgerMetrics metrics;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicLedgerStatsReporter(Supplier<LedgerStats> statsSupplier,
                                       AtomicLedgerMetrics metrics,
                                       long intervalSeconds) {
        this.statsSupplier = Objects.requireNonNull(statsSupplier, "statsSupplier");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ledger-stats-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (Throwable t) {
            LOG.warning("Ledger stats reporter failure: " + t.getClass().getSimpleName());
        }
    }

    String render() {
        LedgerStats stats = statsSupplier.get();
        AtomicLedgerMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "allocation-ledger");
        payload.put("type", "ledger_stats");
        payload.put("totalAllocated", stats.totalAllocated());
        payload.put("totalUsed", stats.totalUsed());
        payload.put("blockCount", stats.blockCount());
        payload.put("fragmentationRatio", stats.fragmentationRatio());
        payload.put("averageUtilization", stats.averageUtilization());
        payload.put("allocations", s.allocations());
        payload.put("evictions", s.evictions());
        payload.put("evictedBytes", s.evictedBytes());
        payload.put("releases", s.releases());
        payload.put("reclamations", s.reclamations());
        payload.put("reclaimedBytes", s.reclaimedBytes());
        payload.put("sweeps", s.sweeps());
        payload.put("sweptBytes", s.sweptBytes());
        payload.put("defragmentations", s.defragmentations());
        payload.put("failuresByReason", s.failuresByReason());
        try {
            return JsonCodec.writeString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
