package com.acme.deeptree.ledger.memory;

import java.util.Objects;

/**
 * Stock {@link PayloadHandleFactory} implementations.
 */
public final class PayloadHandles {
    private static final PayloadHandleFactory WEAK = WeakPayloadHandle::new;
    private static final PayloadHandleFactory STANDARD = payload -> {
        Objects.requireNonNull(payload, "payload");
        if (payload instanceof ManagedPayload managed) {
            return new ManagedPayloadHandle(managed);
        }
        return new WeakPayloadHandle(payload);
    };

    private PayloadHandles() {
    }

    /** Owner flag for {@link ManagedPayload}s, weak reference for everything else. */
    public static PayloadHandleFactory standard() {
        return STANDARD;
    }

    /** Weak reference only; ignores {@link ManagedPayload#isDestroyed()}. */
    public static PayloadHandleFactory weak() {
        return WEAK;
    }
}
