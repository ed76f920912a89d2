package com.salesdw.service;

import com.salesdw.config.BatchTagGenerator;
import com.salesdw.config.EtlMetrics;
import com.salesdw.model.Layer;
import com.salesdw.model.LoadLogEntry;
import com.salesdw.model.LoadStatus;
import com.salesdw.repository.LoadLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Runs one table's step and records its outcome in the load log.
 *
 * A failing step never escapes: the error text is logged with the table's FAILED row and the
 * caller moves on to the next table. Nothing written before the failure is rolled back.
 */
@Component
@Slf4j
public class TableStepRunner {

    static final int MAX_MESSAGE_LENGTH = 2000;

    private final LoadLogRepository loadLogRepository;
    private final BatchTagGenerator batchTagGenerator;
    private final EtlMetrics metrics;

    public TableStepRunner(LoadLogRepository loadLogRepository,
                           BatchTagGenerator batchTagGenerator,
                           EtlMetrics metrics) {
        this.loadLogRepository = loadLogRepository;
        this.batchTagGenerator = batchTagGenerator;
        this.metrics = metrics;
    }

    public LoadLogEntry run(Layer layer, String tableName, String batchTag, String failurePrefix, TableStep step) {
        LoadStatus status;
        String message;
        long start = System.currentTimeMillis();
        try {
            message = step.execute();
            status = LoadStatus.SUCCESS;
            log.info("  {} → SUCCESS in {}ms: {}", tableName, System.currentTimeMillis() - start, message);
        } catch (Exception e) {
            message = failurePrefix + errorText(e);
            status = LoadStatus.FAILED;
            log.error("  {} → FAILED after {}ms: {}", tableName, System.currentTimeMillis() - start, errorText(e));
        }

        LoadLogEntry entry = new LoadLogEntry(layer, tableName, batchTag, status,
                truncate(message), batchTagGenerator.now());
        try {
            loadLogRepository.save(entry);
        } catch (DataAccessException e) {
            log.error("  {} → could not write load log row: {}", tableName, errorText(e));
        }
        metrics.incrementTableOutcome(layer, status == LoadStatus.SUCCESS);
        return entry;
    }

    /**
     * Driver message of the root SQL error, without Spring's statement prefix.
     */
    static String errorText(Exception e) {
        Throwable cause = e instanceof DataAccessException dae ? dae.getMostSpecificCause() : e;
        String text = cause.getMessage();
        return text != null ? text : cause.getClass().getSimpleName();
    }

    private static String truncate(String message) {
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
