package com.salesdw.model;

/**
 * Raw numbers returned by one quality check query before classification.
 *
 * issueCount is null for ratio checks, referenceCount and detail only for checks that select them.
 */
public record CheckMeasurement(
    long totalRows,
    Long issueCount,
    Long referenceCount,
    String detail
) {

    public long issuesOrZero() {
        return issueCount != null ? issueCount : 0L;
    }
}
