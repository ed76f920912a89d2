package com.salesdw.config;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Builds the timestamp-derived tag grouping one run's log and result rows,
 * e.g. {@code StgBatch_20240501_134502}.
 */
@Component
public class BatchTagGenerator {

    public static final String RAW_PREFIX = "RawBatch";
    public static final String STAGING_PREFIX = "StgBatch";
    public static final String WAREHOUSE_PREFIX = "DWBatch";
    public static final String STAGING_QUALITY_PREFIX = "StgQualityCheck";
    public static final String WAREHOUSE_QUALITY_PREFIX = "DWQualityCheck";

    private static final DateTimeFormatter TAG_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    public BatchTagGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next(String prefix) {
        return prefix + "_" + LocalDateTime.now(clock).format(TAG_FORMAT);
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
