package com.acme.deeptree.ledger.telemetry;

/**
 * Notifications published by an allocation ledger to its subscribers.
 */
public sealed interface LedgerEvent {

    /** A record was inserted. */
    record Allocated(String id, long sizeBytes) implements LedgerEvent {}

    /** A live record was evicted by the policy under budget pressure. */
    record Freed(String id, long sizeBytes) implements LedgerEvent {}

    /** A record was removed on request, or replaced by a new allocation under the same id. */
    record Released(String id, long sizeBytes) implements LedgerEvent {}

    /** The collector cleared a payload; its record was dropped without waiting for a sweep. */
    record Reclaimed(String id, long sizeBytes) implements LedgerEvent {}

    /** An allocation could not be charged against the budget. */
    record AllocationFailed(String id, long sizeBytes, int reasonCode) implements LedgerEvent {}

    /** A liveness sweep dropped dead records worth {@code freedBytes}. */
    record SweepComplete(long freedBytes) implements LedgerEvent {}

    record DefragmentComplete(LedgerStats stats) implements LedgerEvent {}

    record Destroyed() implements LedgerEvent {}
}
