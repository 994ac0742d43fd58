package com.acme.deeptree.ledger.util;

/**
 * Canonical environment variable names read by the ledger runtime.
 */
public final class LedgerEnvKeys {
    public static final String LEDGER_MAX_BUDGET_MB = "LEDGER_MAX_BUDGET_MB";
    public static final String LEDGER_IDLE_THRESHOLD_MS = "LEDGER_IDLE_THRESHOLD_MS";
    public static final String LEDGER_SWEEP_INTERVAL_MS = "LEDGER_SWEEP_INTERVAL_MS";
    public static final String LEDGER_DEFRAG_MIN_RATIO = "LEDGER_DEFRAG_MIN_RATIO";
    public static final String LEDGER_DEFRAG_TRIGGER_RATIO = "LEDGER_DEFRAG_TRIGGER_RATIO";

    public static final String LEDGER_STATS_LOG_ENABLED = "LEDGER_STATS_LOG_ENABLED";
    public static final String LEDGER_STATS_LOG_INTERVAL_SEC = "LEDGER_STATS_LOG_INTERVAL_SEC";

    private LedgerEnvKeys() {
    }
}
