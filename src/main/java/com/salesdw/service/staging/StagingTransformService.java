package com.salesdw.service.staging;

import com.salesdw.config.BatchTagGenerator;
import com.salesdw.config.EtlMetrics;
import com.salesdw.model.DuplicateCheckEntry;
import com.salesdw.model.Layer;
import com.salesdw.model.LayerRunResult;
import com.salesdw.model.LoadLogEntry;
import com.salesdw.repository.DuplicateCheckRepository;
import com.salesdw.repository.EtlTableRepository;
import com.salesdw.service.TableStepRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Cleans and deduplicates the raw tables into staging.
 *
 * Per table: count duplicates in raw, record the count, truncate the staging table, then insert
 * one cleaned row per natural key. Rows whose key is null never reach staging.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StagingTransformService {

    static final String SUCCESS_MESSAGE = "Transformed successfully";
    static final String FAILURE_PREFIX = "Transformation failed: ";

    private final EtlTableRepository tableRepository;
    private final DuplicateCheckRepository duplicateCheckRepository;
    private final TableStepRunner stepRunner;
    private final BatchTagGenerator batchTagGenerator;
    private final EtlMetrics metrics;

    public LayerRunResult transformAll() {
        String batchTag = batchTagGenerator.next(BatchTagGenerator.STAGING_PREFIX);
        long startTime = System.currentTimeMillis();
        MDC.put("batchTag", batchTag);
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("STAGING TRANSFORM START: batch {}", batchTag);
            log.info("═══════════════════════════════════════════════════════════════");

            List<LoadLogEntry> entries = new ArrayList<>();
            for (StagingTable table : StagingTable.values()) {
                entries.add(stepRunner.run(Layer.STAGING, table.tableName(), batchTag, FAILURE_PREFIX,
                        () -> transformTable(table, batchTag)));
            }

            long elapsed = System.currentTimeMillis() - startTime;
            metrics.recordLayerTime(Layer.STAGING, elapsed);
            LayerRunResult result = new LayerRunResult(Layer.STAGING, batchTag, List.copyOf(entries), elapsed);

            log.info("STAGING TRANSFORM COMPLETE in {}ms | failed tables: {}", elapsed, result.failedTables());
            return result;
        } finally {
            MDC.remove("batchTag");
        }
    }

    private String transformTable(StagingTable table, String batchTag) {
        long duplicates = tableRepository.queryForLong("staging.duplicateCount", Map.of(
                "keys", table.keyList(),
                "rawTable", table.rawTable(),
                "keyFilter", table.keyFilter()));
        DuplicateCheckEntry check = new DuplicateCheckEntry(table.tableName(), batchTag, duplicates,
                batchTagGenerator.now());
        duplicateCheckRepository.save(check);
        if (duplicates > 0) {
            log.warn("  {}: {} duplicate key rows in {}", table.tableName(), duplicates, table.rawTable());
        }

        tableRepository.truncate(table.tableName());
        int inserted = tableRepository.executeNamed(table.insertQuery(), Collections.emptyMap());
        log.debug("  {}: {} rows inserted", table.tableName(), inserted);
        return SUCCESS_MESSAGE;
    }
}
