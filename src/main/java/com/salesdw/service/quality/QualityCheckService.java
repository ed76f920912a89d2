package com.salesdw.service.quality;

import com.salesdw.config.BatchTagGenerator;
import com.salesdw.config.EtlMetrics;
import com.salesdw.model.CheckMeasurement;
import com.salesdw.model.CheckStatus;
import com.salesdw.model.Layer;
import com.salesdw.model.QualityCheckResult;
import com.salesdw.model.QualityRunResult;
import com.salesdw.repository.QualityCheckRepository;
import com.salesdw.repository.SqlTemplateLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a check battery and appends every result under one batch tag.
 *
 * Checks are independent: each one is measured, classified and stored even when an earlier one
 * failed. A check whose query errors is stored as FAIL with the database message.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QualityCheckService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int MAX_MESSAGE_LENGTH = 1000;

    private final QualityCheckCatalog catalog;
    private final QualityCheckRepository qualityCheckRepository;
    private final SqlTemplateLoader sqlLoader;
    private final BatchTagGenerator batchTagGenerator;
    private final EtlMetrics metrics;

    public QualityRunResult runStagingChecks() {
        return runChecks(Layer.STAGING, BatchTagGenerator.STAGING_QUALITY_PREFIX, catalog.stagingChecks());
    }

    public QualityRunResult runWarehouseChecks() {
        return runChecks(Layer.WAREHOUSE, BatchTagGenerator.WAREHOUSE_QUALITY_PREFIX, catalog.warehouseChecks());
    }

    QualityRunResult runChecks(Layer layer, String prefix, List<QualityCheckDefinition> checks) {
        String batchTag = batchTagGenerator.next(prefix);
        long startTime = System.currentTimeMillis();
        MDC.put("batchTag", batchTag);
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("{} QUALITY CHECKS START: batch {} | {} checks", layer, batchTag, checks.size());
            log.info("═══════════════════════════════════════════════════════════════");

            List<QualityCheckResult> results = new ArrayList<>();
            for (QualityCheckDefinition check : checks) {
                QualityCheckResult result = runCheck(check, batchTag);
                qualityCheckRepository.save(result);
                metrics.incrementQualityResult(result.status());
                results.add(result);
            }

            long elapsed = System.currentTimeMillis() - startTime;
            metrics.recordQualityTime(elapsed);
            QualityRunResult run = new QualityRunResult(layer, batchTag, List.copyOf(results), elapsed);

            log.info("{} QUALITY CHECKS COMPLETE in {}ms | PASS: {} | FAIL: {} | WARNING: {}",
                    layer, elapsed, run.count(CheckStatus.PASS), run.count(CheckStatus.FAIL),
                    run.count(CheckStatus.WARNING));
            return run;
        } finally {
            MDC.remove("batchTag");
        }
    }

    private QualityCheckResult runCheck(QualityCheckDefinition check, String batchTag) {
        try {
            String sql = sqlLoader.render(check.queryName(), check.placeholders());
            CheckMeasurement measurement = qualityCheckRepository.measure(sql);
            CheckStatus status = check.classifier().classify(measurement);
            String message = check.message().render(measurement, status);
            if (status == CheckStatus.PASS) {
                log.debug("  [{}] {} on {} → PASS", check.category(), check.checkName(), check.tableName());
            } else {
                log.warn("  [{}] {} on {} → {}: {}", check.category(), check.checkName(), check.tableName(),
                        status, message);
            }
            return result(check, status, measurement.totalRows(), measurement.issueCount(), message, batchTag);
        } catch (DataAccessException e) {
            return queryFailed(check, e.getMostSpecificCause().getMessage(), batchTag);
        } catch (IllegalArgumentException e) {
            // unknown query name or missing placeholder
            return queryFailed(check, e.getMessage(), batchTag);
        }
    }

    private QualityCheckResult queryFailed(QualityCheckDefinition check, String error, String batchTag) {
        log.error("  [{}] {} on {} → query failed: {}", check.category(), check.checkName(),
                check.tableName(), error);
        return result(check, CheckStatus.FAIL, 0L, null, "Check query failed: " + error, batchTag);
    }

    private QualityCheckResult result(QualityCheckDefinition check, CheckStatus status, long totalRows,
                                      Long issueCount, String message, String batchTag) {
        return new QualityCheckResult(
                check.layer(),
                check.category(),
                check.checkName(),
                check.tableName(),
                status,
                totalRows,
                issueCount,
                issuePercentage(issueCount, totalRows),
                message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH),
                batchTag,
                batchTagGenerator.now());
    }

    /**
     * Share of offending rows in percent, two decimals. Null when there is nothing to divide.
     */
    static BigDecimal issuePercentage(Long issueCount, long totalRows) {
        if (issueCount == null || totalRows == 0) {
            return null;
        }
        return BigDecimal.valueOf(issueCount)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(totalRows), 2, RoundingMode.HALF_UP);
    }
}
