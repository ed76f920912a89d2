package com.salesdw.controller;

import com.salesdw.config.EtlMetrics;
import com.salesdw.model.CheckStatus;
import com.salesdw.model.Layer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsControllerTest {

    private final EtlMetrics metrics = new EtlMetrics(new SimpleMeterRegistry());
    private final MetricsController controller = new MetricsController(metrics);

    @Test
    @SuppressWarnings("unchecked")
    void tables_shouldReportOutcomesPerLayer() {
        metrics.incrementTableOutcome(Layer.STAGING, true);
        metrics.incrementTableOutcome(Layer.STAGING, true);
        metrics.incrementTableOutcome(Layer.STAGING, true);
        metrics.incrementTableOutcome(Layer.STAGING, false);

        Map<String, Object> staging = (Map<String, Object>) controller.getTableMetrics().get("staging");
        Map<String, Object> raw = (Map<String, Object>) controller.getTableMetrics().get("raw");

        assertThat(staging).containsEntry("success", 3L).containsEntry("failed", 1L);
        assertThat((String) staging.get("successRate")).startsWith("75");
        assertThat(raw).containsEntry("successRate", "N/A");
    }

    @Test
    @SuppressWarnings("unchecked")
    void summary_shouldIncludeQualityCountsAndTimers() {
        metrics.incrementQualityResult(CheckStatus.WARNING);
        metrics.incrementRowsLoaded(42);
        metrics.recordPipelineTime(120);

        Map<String, Object> summary = controller.getMetricsSummary();

        assertThat((Map<String, Object>) summary.get("quality")).containsEntry("warning", 1L).containsEntry("fail", 0L);
        assertThat(summary).containsEntry("rowsLoaded", 42L);
        Map<String, Object> timing = (Map<String, Object>) summary.get("timing");
        assertThat((Map<String, Object>) timing.get("pipeline")).containsEntry("count", 1L);
        assertThat((Map<String, Object>) timing.get("warehouse")).containsEntry("avgTimeMs", "N/A");
    }
}
