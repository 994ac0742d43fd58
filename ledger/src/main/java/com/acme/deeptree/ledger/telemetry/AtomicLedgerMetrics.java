package com.acme.deeptree.ledger.telemetry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicLedgerMetrics implements LedgerMetrics {
    private final LongAdder allocations = new LongAdder();
    private final LongAdder allocatedBytes = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder evictedBytes = new LongAdder();
    private final LongAdder releases = new LongAdder();
    private final LongAdder releasedBytes = new LongAdder();
    private final LongAdder reclamations = new LongAdder();
    private final LongAdder reclaimedBytes = new LongAdder();
    private final LongAdder sweeps = new LongAdder();
    private final LongAdder sweptBytes = new LongAdder();
    private final LongAdder defragmentations = new LongAdder();
    private final ConcurrentHashMap<Integer, LongAdder> failuresByReason = new ConcurrentHashMap<>();

    @Override
    public void incAllocations(long bytes) {
        allocations.increment();
        allocatedBytes.add(Math.max(0L, bytes));
    }

    @Override
    public void incEvictions(long bytes) {
        evictions.increment();
        evictedBytes.add(Math.max(0L, bytes));
    }

    @Override
    public void incReleases(long bytes) {
        releases.increment();
        releasedBytes.add(Math.max(0L, bytes));
    }

    @Override
    public void incReclamations(long bytes) {
        reclamations.increment();
        reclaimedBytes.add(Math.max(0L, bytes));
    }

    @Override
    public void incAllocationFailures(int reasonCode) {
        failuresByReason.computeIfAbsent(reasonCode, ignored -> new LongAdder()).increment();
    }

    @Override
    public void incSweeps(long freedBytes) {
        sweeps.increment();
        sweptBytes.add(Math.max(0L, freedBytes));
    }

    @Override
    public void incDefragmentations() {
        defragmentations.increment();
    }

    public Snapshot snapshot() {
        Map<Integer, Long> failures = new HashMap<>();
        failuresByReason.forEach((k, v) -> failures.put(k, v.sum()));
        return new Snapshot(
            allocations.sum(),
            allocatedBytes.sum(),
            evictions.sum(),
            evictedBytes.sum(),
            releases.sum(),
            releasedBytes.sum(),
            reclamations.sum(),
            reclaimedBytes.sum(),
            sweeps.sum(),
            sweptBytes.sum(),
            defragmentations.sum(),
            Collections.unmodifiableMap(failures)
        );
    }

    public record Snapshot(long allocations,
                           long allocatedBytes,
                           long evictions,
                           long evictedBytes,
                           long releases,
                           long releasedBytes,
                           long reclamations,
                           long reclaimedBytes,
                           long sweeps,
                           long sweptBytes,
                           long defragmentations,
                           Map<Integer, Long> failuresByReason) {}
}
