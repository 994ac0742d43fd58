package com.acme.deeptree.ledger.telemetry;

/**
 * Point-in-time ledger statistics.
 *
 * <p>{@code fragmentationRatio = 1 - totalUsed / totalAllocated} (0 for an empty ledger);
 * {@code averageUtilization = totalUsed / maxBudgetBytes}.
 */
public record LedgerStats(long totalAllocated,
                          long totalUsed,
                          int blockCount,
                          double fragmentationRatio,
                          double averageUtilization) {

    public static LedgerStats of(long totalAllocated, long totalUsed, int blockCount, long maxBudgetBytes) {
        double fragmentation = totalAllocated == 0 ? 0.0d : 1.0d - ((double) totalUsed / totalAllocated);
        double utilization = maxBudgetBytes <= 0 ? 0.0d : (double) totalUsed / maxBudgetBytes;
        return new LedgerStats(totalAllocated, totalUsed, blockCount, fragmentation, utilization);
    }
}
