package com.salesdw.service.raw;

import com.salesdw.config.BatchTagGenerator;
import com.salesdw.config.EtlMetrics;
import com.salesdw.model.Layer;
import com.salesdw.model.LayerRunResult;
import com.salesdw.model.LoadLogEntry;
import com.salesdw.repository.EtlTableRepository;
import com.salesdw.service.TableStepRunner;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the source files into the raw tables.
 *
 * Each table is truncated and reloaded verbatim; no keys are checked at this layer.
 * One log row per table per batch.
 */
@Service
@Slf4j
public class RawLoadService {

    static final String SUCCESS_MESSAGE = "Loaded successfully";
    static final String FAILURE_PREFIX = "Load failed - check file path and format: ";

    private final EtlTableRepository tableRepository;
    private final CsvSourceReader csvReader;
    private final TableStepRunner stepRunner;
    private final BatchTagGenerator batchTagGenerator;
    private final EtlMetrics metrics;
    private final Path sourceDir;

    public RawLoadService(
            EtlTableRepository tableRepository,
            CsvSourceReader csvReader,
            TableStepRunner stepRunner,
            BatchTagGenerator batchTagGenerator,
            EtlMetrics metrics,
            @Value("${app.etl.source-dir:data}") String sourceDir) {
        this.tableRepository = tableRepository;
        this.csvReader = csvReader;
        this.stepRunner = stepRunner;
        this.batchTagGenerator = batchTagGenerator;
        this.metrics = metrics;
        this.sourceDir = Path.of(sourceDir);
        log.info("RawLoadService initialized with source directory: {}", this.sourceDir.toAbsolutePath());
    }

    /**
     * Truncate and reload every raw table from its source file.
     */
    public LayerRunResult loadAll() {
        String batchTag = batchTagGenerator.next(BatchTagGenerator.RAW_PREFIX);
        long startTime = System.currentTimeMillis();
        MDC.put("batchTag", batchTag);
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("RAW LOAD START: batch {} | source {}", batchTag, sourceDir);
            log.info("═══════════════════════════════════════════════════════════════");

            List<LoadLogEntry> entries = new ArrayList<>();
            for (RawTable table : RawTable.values()) {
                entries.add(stepRunner.run(Layer.RAW, table.tableName(), batchTag, FAILURE_PREFIX,
                        () -> loadTable(table)));
            }

            long elapsed = System.currentTimeMillis() - startTime;
            metrics.recordLayerTime(Layer.RAW, elapsed);
            LayerRunResult result = new LayerRunResult(Layer.RAW, batchTag, List.copyOf(entries), elapsed);

            log.info("RAW LOAD COMPLETE in {}ms | failed tables: {}", elapsed, result.failedTables());
            return result;
        } finally {
            MDC.remove("batchTag");
        }
    }

    private String loadTable(RawTable table) throws IOException {
        tableRepository.truncate(table.tableName());
        List<Object[]> rows = csvReader.read(sourceDir.resolve(table.fileName()), table.columns().size());
        int inserted = tableRepository.insertRows(table.tableName(), table.columns(), rows);
        metrics.incrementRowsLoaded(inserted);
        return SUCCESS_MESSAGE + " (" + inserted + " rows)";
    }
}
