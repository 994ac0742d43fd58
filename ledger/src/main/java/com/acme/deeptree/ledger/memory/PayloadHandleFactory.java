package com.acme.deeptree.ledger.memory;

@FunctionalInterface
public interface PayloadHandleFactory {
    PayloadHandle handleFor(Object payload);
}
