package com.salesdw.config;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class BatchTagGeneratorTest {

    private final BatchTagGenerator generator =
            new BatchTagGenerator(Clock.fixed(Instant.parse("2024-05-01T09:05:07Z"), ZoneOffset.UTC));

    @Test
    void next_shouldAppendTimestampToPrefix() {
        assertThat(generator.next(BatchTagGenerator.RAW_PREFIX)).isEqualTo("RawBatch_20240501_090507");
        assertThat(generator.next(BatchTagGenerator.STAGING_PREFIX)).isEqualTo("StgBatch_20240501_090507");
        assertThat(generator.next(BatchTagGenerator.WAREHOUSE_PREFIX)).isEqualTo("DWBatch_20240501_090507");
        assertThat(generator.next(BatchTagGenerator.WAREHOUSE_QUALITY_PREFIX))
                .isEqualTo("DWQualityCheck_20240501_090507");
    }

    @Test
    void now_shouldReadTheClock() {
        assertThat(generator.now()).isEqualTo(LocalDateTime.of(2024, 5, 1, 9, 5, 7));
    }
}
