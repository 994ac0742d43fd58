package com.acme.deeptree.ledger.memory;

import com.acme.deeptree.ledger.telemetry.LedgerEventBus;
import com.acme.deeptree.ledger.telemetry.LedgerEventListener;
import com.acme.deeptree.ledger.telemetry.LedgerStats;
import com.acme.deeptree.ledger.util.LedgerDefaults;

/**
 * Budget-constrained accounting of logical objects owned elsewhere.
 *
 * <p>Implementations must be thread-safe. The ledger never owns a payload: it keeps a
 * non-owning handle and drops the record once the owner has destroyed the payload.
 * After {@link #destroy()} every operation fails with {@link LedgerTerminatedException}.
 */
public interface AllocationLedger extends AutoCloseable {

    /**
     * Charges {@code sizeBytes} for {@code payload} under {@code id}, evicting idle
     * low-tier records if the budget requires it. An existing record with the same id is
     * released first.
     *
     * <p>Callers must not assume any other record survives this call.
     *
     * @throws InsufficientBudgetException if the budget cannot be met after eviction
     * @throws IllegalArgumentException    for a blank id, non-positive size or negative tier
     */
    void allocate(String id, long sizeBytes, Object payload, int priorityTier);

    default void allocate(String id, long sizeBytes, Object payload) {
        allocate(id, sizeBytes, payload, LedgerDefaults.DEFAULT_PRIORITY_TIER);
    }

    /** Same as {@link #allocate(String, long, Object, int)} with a caller-built handle. */
    void allocate(String id, long sizeBytes, PayloadHandle handle, int priorityTier);

    /**
     * Returns the live payload and refreshes its access time.
     *
     * @throws RecordNotFoundException    if no record exists for {@code id}
     * @throws PayloadReclaimedException  if the payload is gone; the record is removed
     */
    Object access(String id);

    default <T> T access(String id, Class<T> type) {
        return type.cast(access(id));
    }

    /**
     * Removes the record and returns its size.
     *
     * @throws RecordNotFoundException if no record exists for {@code id}
     */
    long release(String id);

    /**
     * Walks the eviction order and removes dead or idle low-tier records until at least
     * {@code requiredBytes} have been freed.
     *
     * @return bytes freed
     * @throws InsufficientBudgetException if the walk frees less than required; nothing is restored
     */
    long freeUpSpace(long requiredBytes);

    /**
     * Records the owner's figure for bytes in use. The ledger never revises it by itself.
     *
     * @throws RecordNotFoundException  if no record exists for {@code id}
     * @throws IllegalArgumentException unless {@code 0 <= usedBytes <= sizeBytes}
     */
    void reportUsage(String id, long usedBytes);

    boolean contains(String id);

    /** Drops every record whose payload is gone. Returns the bytes freed. */
    long sweep();

    /**
     * Rebuilds the ledger from its live records, highest tier first.
     *
     * @return {@code false} if fragmentation was below the threshold and nothing changed
     */
    boolean defragment();

    LedgerStats getStats();

    long maxBudgetBytes();

    LedgerEventBus.Subscription subscribe(LedgerEventListener listener);

    /**
     * Stops the periodic sweep, drops all records and terminates the ledger.
     *
     * @throws LedgerTerminatedException if already destroyed
     */
    void destroy();

    /** Idempotent {@link #destroy()}. */
    @Override
    void close();
}
