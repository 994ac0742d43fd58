package com.acme.deeptree.ledger.eviction;

import com.acme.deeptree.ledger.memory.AllocationRecord;
import com.acme.deeptree.ledger.util.LedgerDefaults;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Lowest tier first, least recently accessed first within a tier.
 *
 * <p>A live record is evictable only while its tier is below the protected tier and it
 * has been idle for strictly longer than the idle threshold. Live protected records are
 * never chosen.
 */
public final class PriorityRecencyEvictionPolicy implements EvictionPolicy {
    private static final Comparator<AllocationRecord> ORDER = Comparator
        .comparingInt(AllocationRecord::priorityTier)
        .thenComparingLong(AllocationRecord::lastAccessedAt)
        .thenComparing(AllocationRecord::id);

    private final long idleThresholdMillis;
    private final int protectedTier;

    public PriorityRecencyEvictionPolicy(long idleThresholdMillis) {
        this(idleThresholdMillis, LedgerDefaults.PROTECTED_PRIORITY_TIER);
    }

    public PriorityRecencyEvictionPolicy(long idleThresholdMillis, int protectedTier) {
        if (idleThresholdMillis < 0) {
            throw new IllegalArgumentException("idleThresholdMillis must be >= 0, got " + idleThresholdMillis);
        }
        if (protectedTier < 0) {
            throw new IllegalArgumentException("protectedTier must be >= 0, got " + protectedTier);
        }
        this.idleThresholdMillis = idleThresholdMillis;
        this.protectedTier = protectedTier;
    }

    @Override
    public List<AllocationRecord> order(Collection<AllocationRecord> records) {
        List<AllocationRecord> sorted = new ArrayList<>(records);
        sorted.sort(ORDER);
        return sorted;
    }

    @Override
    public EvictionDecision decide(AllocationRecord record, boolean alive, long nowMillis) {
        if (!alive) {
            return EvictionDecision.RECLAIM_DEAD;
        }
        if (record.priorityTier() < protectedTier
            && nowMillis - record.lastAccessedAt() > idleThresholdMillis) {
            return EvictionDecision.EVICT_IDLE;
        }
        return EvictionDecision.KEEP;
    }

    public long idleThresholdMillis() {
        return idleThresholdMillis;
    }

    public int protectedTier() {
        return protectedTier;
    }
}
