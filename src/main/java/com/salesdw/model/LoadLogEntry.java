package com.salesdw.model;

import java.time.LocalDateTime;

/**
 * One row of the load log: the outcome of loading or transforming one table in one batch.
 */
public record LoadLogEntry(
    Layer layer,
    String tableName,
    String batchTag,
    LoadStatus status,
    String message,
    LocalDateTime loadTime
) {

    public boolean isSuccess() {
        return status == LoadStatus.SUCCESS;
    }
}
