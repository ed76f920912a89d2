package com.salesdw.model;

import java.math.BigDecimal;

/**
 * Per-category roll-up of one quality batch. passRate is the share of PASS checks in percent.
 */
public record CategorySummary(
    String category,
    long totalChecks,
    long passed,
    long failed,
    long warnings,
    BigDecimal passRate
) {}
