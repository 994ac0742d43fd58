package com.acme.deeptree.ledger.util;

/**
 * Default budget, timing, and threshold constants for the ledger runtime.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class LedgerDefaults {

    // ---- Budget ----
    public static final int DEFAULT_MAX_BUDGET_MB = 1024;
    public static final int MAX_BUDGET_MB_CEILING = 1024 * 1024;
    public static final long BYTES_PER_MB = 1024L * 1024;

    // ---- Eviction / sweep (millis) ----
    public static final long DEFAULT_IDLE_THRESHOLD_MS = 300_000L;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000L;
    public static final long MIN_SWEEP_INTERVAL_MS = 10L;
    public static final long RECLAIM_POLL_INTERVAL_MS = 1_000L;

    // ---- Priority tiers ----
    public static final int DEFAULT_PRIORITY_TIER = 1;
    public static final int PROTECTED_PRIORITY_TIER = 2;

    // ---- Compaction ----
    public static final double DEFAULT_DEFRAG_MIN_RATIO = 0.2d;
    public static final double DEFAULT_DEFRAG_TRIGGER_RATIO = 0.3d;

    // ---- Stats reporter ----
    public static final int DEFAULT_STATS_LOG_INTERVAL_SEC = 30;

    // ---- Teardown ----
    public static final long SWEEP_SHUTDOWN_WAIT_MS = 5_000L;

    private LedgerDefaults() {
    }
}
