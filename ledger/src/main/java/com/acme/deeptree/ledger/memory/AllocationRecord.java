package com.acme.deeptree.ledger.memory;

import java.lang.ref.Reference;
import java.util.Objects;

/**
 * Accounting entry for one tracked object.
 *
 * <p>{@code sizeBytes}, {@code priorityTier} and the handle are fixed at creation.
 * Access time and reported usage change under the owning ledger's lock only.
 */
public final class AllocationRecord {
    private final String id;
    private final long sizeBytes;
    private final int priorityTier;
    private final PayloadHandle handle;
    private long usedBytes;
    private long lastAccessedAt;
    private Reference<?> collectionWatch;

    AllocationRecord(String id, long sizeBytes, int priorityTier, PayloadHandle handle, long createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.sizeBytes = sizeBytes;
        this.priorityTier = priorityTier;
        this.handle = Objects.requireNonNull(handle, "handle");
        this.usedBytes = sizeBytes;
        this.lastAccessedAt = createdAt;
    }

    /** Builds a detached record, for policy evaluation outside a ledger. */
    public static AllocationRecord of(String id, long sizeBytes, int priorityTier,
                                      PayloadHandle handle, long lastAccessedAt) {
        return new AllocationRecord(id, sizeBytes, priorityTier, handle, lastAccessedAt);
    }

    public String id() {
        return id;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public long usedBytes() {
        return usedBytes;
    }

    public long lastAccessedAt() {
        return lastAccessedAt;
    }

    public int priorityTier() {
        return priorityTier;
    }

    public PayloadHandle handle() {
        return handle;
    }

    void touch(long nowMillis) {
        lastAccessedAt = nowMillis;
    }

    void usedBytes(long usedBytes) {
        this.usedBytes = usedBytes;
    }

    void watch(Reference<?> watch) {
        this.collectionWatch = watch;
    }

    /** Stops collection notices for this record; a cleared reference is never enqueued. */
    void unwatch() {
        if (collectionWatch != null) {
            collectionWatch.clear();
            collectionWatch = null;
        }
    }

    @Override
    public String toString() {
        return "AllocationRecord{id=" + id
            + ", sizeBytes=" + sizeBytes
            + ", usedBytes=" + usedBytes
            + ", priorityTier=" + priorityTier
            + ", lastAccessedAt=" + lastAccessedAt + '}';
    }
}
