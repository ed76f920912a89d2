package com.salesdw.model;

import java.time.LocalDateTime;

/**
 * Duplicate count found in a raw table before it was deduplicated into staging.
 */
public record DuplicateCheckEntry(
    String tableName,
    String batchTag,
    long duplicateCount,
    LocalDateTime checkedAt
) {

    public static final String DUPLICATE_FOUND = "DUPLICATE FOUND";
    public static final String NO_DUPLICATE = "NO DUPLICATE";

    public String duplicateStatus() {
        return duplicateCount > 0 ? DUPLICATE_FOUND : NO_DUPLICATE;
    }
}
