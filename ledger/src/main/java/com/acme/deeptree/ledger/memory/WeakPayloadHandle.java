package com.acme.deeptree.ledger.memory;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.Optional;

/**
 * Handle backed by a {@link WeakReference}: the payload is dead once the collector clears it.
 */
public final class WeakPayloadHandle implements PayloadHandle {
    private final WeakReference<Object> ref;

    public WeakPayloadHandle(Object payload) {
        this.ref = new WeakReference<>(Objects.requireNonNull(payload, "payload"));
    }

    @Override
    public Optional<Object> tryResolve() {
        return Optional.ofNullable(ref.get());
    }
}
