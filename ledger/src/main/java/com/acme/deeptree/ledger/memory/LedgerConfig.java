package com.acme.deeptree.ledger.memory;

import com.acme.deeptree.ledger.util.EnvVars;
import com.acme.deeptree.ledger.util.LedgerDefaults;
import com.acme.deeptree.ledger.util.LedgerEnvKeys;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable ledger settings.
 *
 * @param maxBudgetBytes        ceiling for the sum of tracked sizes
 * @param idleThresholdMillis   idle time after which a low-tier record may be evicted
 * @param sweepIntervalMillis   period of the liveness sweep
 * @param defragMinRatio        fragmentation below which {@code defragment()} is a no-op
 * @param defragTriggerRatio    fragmentation above which the watcher requests compaction
 * @param statsLogEnabled       whether the runtime logs stats periodically
 * @param statsLogIntervalSec   stats logging period
 */
public record LedgerConfig(long maxBudgetBytes,
                           long idleThresholdMillis,
                           long sweepIntervalMillis,
                           double defragMinRatio,
                           double defragTriggerRatio,
                           boolean statsLogEnabled,
                           int statsLogIntervalSec) {

    public LedgerConfig {
        if (maxBudgetBytes <= 0) {
            throw new IllegalArgumentException("maxBudgetBytes must be positive, got " + maxBudgetBytes);
        }
        if (idleThresholdMillis < 0) {
            throw new IllegalArgumentException("idleThresholdMillis must be >= 0, got " + idleThresholdMillis);
        }
        if (sweepIntervalMillis < LedgerDefaults.MIN_SWEEP_INTERVAL_MS) {
            throw new IllegalArgumentException(
                "sweepIntervalMillis must be >= " + LedgerDefaults.MIN_SWEEP_INTERVAL_MS + ", got " + sweepIntervalMillis);
        }
        if (statsLogIntervalSec <= 0) {
            throw new IllegalArgumentException("statsLogIntervalSec must be positive, got " + statsLogIntervalSec);
        }
    }

    public static LedgerConfig defaults() {
        return new LedgerConfig(
            LedgerDefaults.DEFAULT_MAX_BUDGET_MB * LedgerDefaults.BYTES_PER_MB,
            LedgerDefaults.DEFAULT_IDLE_THRESHOLD_MS,
            LedgerDefaults.DEFAULT_SWEEP_INTERVAL_MS,
            LedgerDefaults.DEFAULT_DEFRAG_MIN_RATIO,
            LedgerDefaults.DEFAULT_DEFRAG_TRIGGER_RATIO,
            true,
            LedgerDefaults.DEFAULT_STATS_LOG_INTERVAL_SEC
        );
    }

    public static LedgerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static LedgerConfig fromEnv(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        int budgetMb = EnvVars.getIntClamped(env, LedgerEnvKeys.LEDGER_MAX_BUDGET_MB,
            LedgerDefaults.DEFAULT_MAX_BUDGET_MB, 1, LedgerDefaults.MAX_BUDGET_MB_CEILING);
        long idleMs = EnvVars.getLongClamped(env, LedgerEnvKeys.LEDGER_IDLE_THRESHOLD_MS,
            LedgerDefaults.DEFAULT_IDLE_THRESHOLD_MS, 0L, Long.MAX_VALUE);
        long sweepMs = EnvVars.getLongClamped(env, LedgerEnvKeys.LEDGER_SWEEP_INTERVAL_MS,
            LedgerDefaults.DEFAULT_SWEEP_INTERVAL_MS, LedgerDefaults.MIN_SWEEP_INTERVAL_MS, 86_400_000L);
        double minRatio = EnvVars.getDoubleClamped(env, LedgerEnvKeys.LEDGER_DEFRAG_MIN_RATIO,
            LedgerDefaults.DEFAULT_DEFRAG_MIN_RATIO, 0.0d, 1.0d);
        double triggerRatio = EnvVars.getDoubleClamped(env, LedgerEnvKeys.LEDGER_DEFRAG_TRIGGER_RATIO,
            LedgerDefaults.DEFAULT_DEFRAG_TRIGGER_RATIO, 0.0d, 1.0d);
        boolean statsEnabled = EnvVars.getBoolean(env, LedgerEnvKeys.LEDGER_STATS_LOG_ENABLED, true);
        int statsIntervalSec = EnvVars.getIntClamped(env, LedgerEnvKeys.LEDGER_STATS_LOG_INTERVAL_SEC,
            LedgerDefaults.DEFAULT_STATS_LOG_INTERVAL_SEC, 1, 3600);
        return new LedgerConfig(
            budgetMb * LedgerDefaults.BYTES_PER_MB,
            idleMs,
            sweepMs,
            minRatio,
            triggerRatio,
            statsEnabled,
            statsIntervalSec
        );
    }

    public LedgerConfig withMaxBudgetBytes(long bytes) {
        return new LedgerConfig(bytes, idleThresholdMillis, sweepIntervalMillis,
            defragMinRatio, defragTriggerRatio, statsLogEnabled, statsLogIntervalSec);
    }

    public LedgerConfig withIdleThresholdMillis(long millis) {
        return new LedgerConfig(maxBudgetBytes, millis, sweepIntervalMillis,
            defragMinRatio, defragTriggerRatio, statsLogEnabled, statsLogIntervalSec);
    }

    public LedgerConfig withSweepIntervalMillis(long millis) {
        return new LedgerConfig(maxBudgetBytes, idleThresholdMillis, millis,
            defragMinRatio, defragTriggerRatio, statsLogEnabled, statsLogIntervalSec);
    }

    public LedgerConfig withStatsLogEnabled(boolean enabled) {
        return new LedgerConfig(maxBudgetBytes, idleThresholdMillis, sweepIntervalMillis,
            defragMinRatio, defragTriggerRatio, enabled, statsLogIntervalSec);
    }
}
