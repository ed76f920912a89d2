package com.salesdw.model;

import java.util.List;

/**
 * Result of one quality check battery.
 */
public record QualityRunResult(
    Layer layer,
    String batchTag,
    List<QualityCheckResult> results,
    long durationMs
) {

    public long count(CheckStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    public boolean hasFailures() {
        return count(CheckStatus.FAIL) > 0;
    }
}
