package com.acme.deeptree.ledger.memory;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.Optional;

/**
 * Handle for {@link ManagedPayload}s: dead when the owner has flagged destruction or the
 * object has been collected, whichever comes first.
 */
public final class ManagedPayloadHandle implements PayloadHandle {
    private final WeakReference<ManagedPayload> ref;

    public ManagedPayloadHandle(ManagedPayload payload) {
        this.ref = new WeakReference<>(Objects.requireNonNull(payload, "payload"));
    }

    @Override
    public Optional<Object> tryResolve() {
        ManagedPayload payload = ref.get();
        if (payload == null || payload.isDestroyed()) {
            return Optional.empty();
        }
        return Optional.of(payload);
    }
}
