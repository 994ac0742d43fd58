package com.acme.deeptree.ledger.util;

/**
 * Reason codes carried by ledger failures.
 * <p>
 * Values follow HTTP status semantics so an outer service can surface them unchanged.
 */
public final class LedgerStatusCodes {

    public static final int NOT_FOUND = 404;
    public static final int GONE = 410;

    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int INSUFFICIENT_STORAGE = 507;

    private LedgerStatusCodes() {
    }
}
