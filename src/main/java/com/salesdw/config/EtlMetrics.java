package com.salesdw.config;

import com.salesdw.model.CheckStatus;
import com.salesdw.model.Layer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Pipeline metrics.
 *
 * Key metrics (view at /actuator/metrics or /api/metrics/summary):
 * - etl.layer.duration{layer}     → time per layer entry point
 * - etl.pipeline.duration         → full raw → warehouse run
 * - etl.table.success{layer}      → tables loaded/transformed successfully
 * - etl.table.failed{layer}       → tables whose step failed
 * - etl.quality.result{status}    → quality checks by outcome
 * - etl.rows.loaded               → rows read from source files into the raw layer
 */
@Component
@Getter
public class EtlMetrics {

    private final Timer pipelineTimer;
    private final Map<Layer, Timer> layerTimers = new EnumMap<>(Layer.class);
    private final Timer qualityTimer;

    private final Map<Layer, Counter> tableSuccessCounters = new EnumMap<>(Layer.class);
    private final Map<Layer, Counter> tableFailedCounters = new EnumMap<>(Layer.class);
    private final Map<CheckStatus, Counter> qualityCounters = new EnumMap<>(CheckStatus.class);
    private final Counter rowsLoadedCounter;

    public EtlMetrics(MeterRegistry registry) {
        // ═══════════════════════════════════════════════════════════════
        // TIMERS
        // ═══════════════════════════════════════════════════════════════

        this.pipelineTimer = Timer.builder("etl.pipeline.duration")
                .description("Full raw to warehouse pipeline run time")
                .register(registry);

        this.qualityTimer = Timer.builder("etl.quality.duration")
                .description("Quality check battery run time")
                .register(registry);

        for (Layer layer : Layer.values()) {
            String tag = layer.name().toLowerCase();
            layerTimers.put(layer, Timer.builder("etl.layer.duration")
                    .description("Layer entry point run time")
                    .tag("layer", tag)
                    .register(registry));

            tableSuccessCounters.put(layer, Counter.builder("etl.table.success")
                    .description("Tables processed successfully")
                    .tag("layer", tag)
                    .register(registry));

            tableFailedCounters.put(layer, Counter.builder("etl.table.failed")
                    .description("Tables whose load or transform failed")
                    .tag("layer", tag)
                    .register(registry));
        }

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS
        // ═══════════════════════════════════════════════════════════════

        for (CheckStatus status : CheckStatus.values()) {
            qualityCounters.put(status, Counter.builder("etl.quality.result")
                    .description("Quality checks by outcome")
                    .tag("status", status.name())
                    .register(registry));
        }

        this.rowsLoadedCounter = Counter.builder("etl.rows.loaded")
                .description("Rows read from source files into the raw layer")
                .register(registry);
    }

    public void recordLayerTime(Layer layer, long millis) {
        layerTimers.get(layer).record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordPipelineTime(long millis) {
        pipelineTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordQualityTime(long millis) {
        qualityTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementTableOutcome(Layer layer, boolean success) {
        (success ? tableSuccessCounters : tableFailedCounters).get(layer).increment();
    }

    public void incrementQualityResult(CheckStatus status) {
        qualityCounters.get(status).increment();
    }

    public void incrementRowsLoaded(long rows) {
        rowsLoadedCounter.increment(rows);
    }
}
