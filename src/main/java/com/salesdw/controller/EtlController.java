package com.salesdw.controller;

import com.salesdw.model.DuplicateCheckEntry;
import com.salesdw.model.LayerRunResult;
import com.salesdw.model.LoadLogEntry;
import com.salesdw.model.PipelineRunResult;
import com.salesdw.model.QualityCheckResult;
import com.salesdw.model.QualityRunResult;
import com.salesdw.model.QualitySummary;
import com.salesdw.repository.DuplicateCheckRepository;
import com.salesdw.repository.LoadLogRepository;
import com.salesdw.repository.QualityCheckRepository;
import com.salesdw.service.EtlPipelineOrchestrator;
import com.salesdw.service.quality.QualityCheckService;
import com.salesdw.service.quality.QualitySummaryService;
import com.salesdw.service.raw.RawLoadService;
import com.salesdw.service.staging.StagingTransformService;
import com.salesdw.service.warehouse.WarehouseLoadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST entry points for the ETL layers and their audit tables.
 *
 * Runs are synchronous: the response carries the layer result once every table is done.
 *
 * Example: POST /api/etl/run, then GET /api/etl/logs?batchTag=StgBatch_20240501_134502
 */
@RestController
@RequestMapping("/api/etl")
@Slf4j
@RequiredArgsConstructor
public class EtlController {

    private static final int DEFAULT_LOG_LIMIT = 100;

    private final RawLoadService rawLoadService;
    private final StagingTransformService stagingTransformService;
    private final WarehouseLoadService warehouseLoadService;
    private final QualityCheckService qualityCheckService;
    private final QualitySummaryService qualitySummaryService;
    private final EtlPipelineOrchestrator orchestrator;
    private final LoadLogRepository loadLogRepository;
    private final DuplicateCheckRepository duplicateCheckRepository;
    private final QualityCheckRepository qualityCheckRepository;

    @PostMapping("/raw")
    public ResponseEntity<LayerRunResult> loadRaw() {
        return ResponseEntity.ok(rawLoadService.loadAll());
    }

    @PostMapping("/staging")
    public ResponseEntity<LayerRunResult> transformStaging() {
        return ResponseEntity.ok(stagingTransformService.transformAll());
    }

    @PostMapping("/warehouse")
    public ResponseEntity<LayerRunResult> loadWarehouse() {
        return ResponseEntity.ok(warehouseLoadService.loadAll());
    }

    @PostMapping("/quality/staging")
    public ResponseEntity<QualityRunResult> checkStaging() {
        return ResponseEntity.ok(qualityCheckService.runStagingChecks());
    }

    @PostMapping("/quality/warehouse")
    public ResponseEntity<QualityRunResult> checkWarehouse() {
        return ResponseEntity.ok(qualityCheckService.runWarehouseChecks());
    }

    @PostMapping("/run")
    public ResponseEntity<PipelineRunResult> runPipeline() {
        log.info("Full pipeline run requested");
        return ResponseEntity.ok(orchestrator.runFullPipeline());
    }

    /**
     * Log rows of one batch, or the most recent rows across batches when no tag is given.
     */
    @GetMapping("/logs")
    public List<LoadLogEntry> logs(@RequestParam(required = false) String batchTag) {
        return batchTag != null
                ? loadLogRepository.findByBatchTag(batchTag)
                : loadLogRepository.findRecent(DEFAULT_LOG_LIMIT);
    }

    @GetMapping("/quality")
    public List<QualityCheckResult> qualityResults(@RequestParam String batchTag) {
        return qualityCheckRepository.findByBatchTag(batchTag);
    }

    @GetMapping("/quality/summary")
    public QualitySummary qualitySummary(@RequestParam String batchTag) {
        return qualitySummaryService.summarize(batchTag);
    }

    @GetMapping("/duplicates")
    public List<DuplicateCheckEntry> duplicates(@RequestParam String batchTag) {
        return duplicateCheckRepository.findByBatchTag(batchTag);
    }
}
