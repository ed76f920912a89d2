package com.salesdw.controller;

import com.salesdw.config.EtlMetrics;
import com.salesdw.model.CheckStatus;
import com.salesdw.model.Layer;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST endpoint for pipeline metrics.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final EtlMetrics etlMetrics;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("tables", getTableMetrics());
        response.put("quality", getQualityMetrics());
        response.put("timing", getTimingMetrics());
        response.put("rowsLoaded", (long) etlMetrics.getRowsLoadedCounter().count());

        return response;
    }

    /**
     * Table outcomes per layer.
     */
    @GetMapping("/tables")
    public Map<String, Object> getTableMetrics() {
        Map<String, Object> tables = new LinkedHashMap<>();

        for (Layer layer : Layer.values()) {
            double success = etlMetrics.getTableSuccessCounters().get(layer).count();
            double failed = etlMetrics.getTableFailedCounters().get(layer).count();
            double total = success + failed;

            Map<String, Object> layerStats = new LinkedHashMap<>();
            layerStats.put("success", (long) success);
            layerStats.put("failed", (long) failed);
            if (total > 0) {
                layerStats.put("successRate", String.format("%.2f%%", (success / total) * 100));
            } else {
                layerStats.put("successRate", "N/A");
            }
            tables.put(layer.name().toLowerCase(), layerStats);
        }

        return tables;
    }

    @GetMapping("/quality")
    public Map<String, Object> getQualityMetrics() {
        Map<String, Object> quality = new LinkedHashMap<>();
        for (CheckStatus status : CheckStatus.values()) {
            quality.put(status.name().toLowerCase(), (long) etlMetrics.getQualityCounters().get(status).count());
        }
        quality.put("runs", getTimerStats(etlMetrics.getQualityTimer()));
        return quality;
    }

    @GetMapping("/timing")
    public Map<String, Object> getTimingMetrics() {
        Map<String, Object> timing = new LinkedHashMap<>();

        timing.put("pipeline", getTimerStats(etlMetrics.getPipelineTimer()));
        for (Layer layer : Layer.values()) {
            timing.put(layer.name().toLowerCase(), getTimerStats(etlMetrics.getLayerTimers().get(layer)));
        }

        return timing;
    }

    /**
     * Extract stats from a Timer.
     */
    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }

        return stats;
    }
}
