package com.salesdw.model;

/**
 * Outcome of a single quality check.
 */
public enum CheckStatus {
    PASS,
    FAIL,
    WARNING
}
