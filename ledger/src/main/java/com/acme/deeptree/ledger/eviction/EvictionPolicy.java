package com.acme.deeptree.ledger.eviction;

import com.acme.deeptree.ledger.memory.AllocationRecord;

import java.util.Collection;
import java.util.List;

/**
 * Chooses which allocation records give way under budget pressure.
 *
 * <p>Implementations are pure: they never resolve payload handles or mutate records.
 * The ledger resolves liveness and passes it in.
 */
public interface EvictionPolicy {

    /**
     * Returns the candidates in the order they should be considered, first victim first.
     *
     * @param records current records; not modified
     * @return a new list the caller may freely mutate or remove from while walking
     */
    List<AllocationRecord> order(Collection<AllocationRecord> records);

    /**
     * Decides what happens to a single candidate.
     *
     * @param record    candidate record
     * @param alive     whether its payload handle still resolves
     * @param nowMillis current monotonic time
     */
    EvictionDecision decide(AllocationRecord record, boolean alive, long nowMillis);
}
