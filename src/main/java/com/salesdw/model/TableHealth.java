package com.salesdw.model;

/**
 * Per-table roll-up of one quality batch.
 */
public record TableHealth(
    String tableName,
    long totalChecks,
    long passed,
    long failed,
    long warnings,
    String status
) {

    public static final String HEALTHY = "HEALTHY";
    public static final String NEEDS_ATTENTION = "NEEDS ATTENTION";
    public static final String CRITICAL = "CRITICAL";
}
