package com.salesdw.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One row of the quality check results table.
 *
 * issueCount and issuePercentage are null for checks that measure a ratio rather than
 * counting offending rows (the cardinality check).
 */
public record QualityCheckResult(
    Layer layer,
    String category,
    String checkName,
    String tableName,
    CheckStatus status,
    long totalRows,
    Long issueCount,
    BigDecimal issuePercentage,
    String message,
    String batchTag,
    LocalDateTime checkedAt
) {}
