package com.salesdw.service;

import com.salesdw.config.EtlMetrics;
import com.salesdw.model.CheckStatus;
import com.salesdw.model.LayerRunResult;
import com.salesdw.model.PipelineRunResult;
import com.salesdw.model.QualityRunResult;
import com.salesdw.service.quality.QualityCheckService;
import com.salesdw.service.raw.RawLoadService;
import com.salesdw.service.staging.StagingTransformService;
import com.salesdw.service.warehouse.WarehouseLoadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the whole pipeline in order:
 *
 * 1. RAW        → reload raw tables from the source files
 * 2. STAGING    → clean and deduplicate into staging
 * 3. QC         → staging quality checks
 * 4. WAREHOUSE  → load dimensions and facts
 * 5. QC         → warehouse quality checks
 *
 * A layer with failed tables does not stop the next one; the load log and quality
 * results show what went wrong.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EtlPipelineOrchestrator {

    private final RawLoadService rawLoadService;
    private final StagingTransformService stagingTransformService;
    private final WarehouseLoadService warehouseLoadService;
    private final QualityCheckService qualityCheckService;
    private final EtlMetrics metrics;

    public PipelineRunResult runFullPipeline() {
        long startTime = System.currentTimeMillis();
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("PIPELINE START");
        log.info("═══════════════════════════════════════════════════════════════");

        LayerRunResult raw = rawLoadService.loadAll();
        LayerRunResult staging = stagingTransformService.transformAll();
        QualityRunResult stagingQuality = qualityCheckService.runStagingChecks();
        LayerRunResult warehouse = warehouseLoadService.loadAll();
        QualityRunResult warehouseQuality = qualityCheckService.runWarehouseChecks();

        long totalTime = System.currentTimeMillis() - startTime;
        metrics.recordPipelineTime(totalTime);
        PipelineRunResult result = new PipelineRunResult(raw, staging, stagingQuality, warehouse,
                warehouseQuality, totalTime);

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("PIPELINE COMPLETE in {}ms", totalTime);
        log.info("  Raw:       {}ms | failed: {}", raw.durationMs(), raw.failedTables());
        log.info("  Staging:   {}ms | failed: {}", staging.durationMs(), staging.failedTables());
        log.info("  Warehouse: {}ms | failed: {}", warehouse.durationMs(), warehouse.failedTables());
        log.info("  Staging QC:   {} FAIL / {} WARNING", stagingQuality.count(CheckStatus.FAIL),
                stagingQuality.count(CheckStatus.WARNING));
        log.info("  Warehouse QC: {} FAIL / {} WARNING", warehouseQuality.count(CheckStatus.FAIL),
                warehouseQuality.count(CheckStatus.WARNING));
        log.info("═══════════════════════════════════════════════════════════════");

        if (result.hasLoadErrors()) {
            log.warn("Pipeline finished with failed tables, see load_log");
        }
        return result;
    }
}
