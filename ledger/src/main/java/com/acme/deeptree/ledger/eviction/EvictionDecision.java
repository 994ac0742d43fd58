package com.acme.deeptree.ledger.eviction;

public enum EvictionDecision {
    /** Payload already gone; dropping the record needs no policy judgment. */
    RECLAIM_DEAD,
    /** Live, low-tier and idle past the threshold. */
    EVICT_IDLE,
    KEEP;

    public boolean removes() {
        return this != KEEP;
    }
}
