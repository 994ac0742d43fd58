package com.acme.deeptree.ledger.memory;

import java.util.Optional;

/**
 * Non-owning reference to a tracked payload.
 *
 * <p>Holding a handle must not extend the payload's lifetime. Once the owner destroys the
 * payload, {@link #tryResolve()} returns empty from then on.
 */
public interface PayloadHandle {

    /** Returns the payload if it is still alive. */
    Optional<Object> tryResolve();

    default boolean isAlive() {
        return tryResolve().isPresent();
    }
}
