package com.acme.deeptree.ledger.memory;

/**
 * Payload whose owner destroys it explicitly.
 * After {@link #isDestroyed()} turns true the ledger treats the payload as gone, even if
 * the object itself is still reachable.
 */
public interface ManagedPayload {
    boolean isDestroyed();
}
