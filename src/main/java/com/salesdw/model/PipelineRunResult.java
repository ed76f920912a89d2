package com.salesdw.model;

/**
 * Full raw to warehouse run with both quality check batteries.
 */
public record PipelineRunResult(
    LayerRunResult raw,
    LayerRunResult staging,
    QualityRunResult stagingQuality,
    LayerRunResult warehouse,
    QualityRunResult warehouseQuality,
    long totalTimeMs
) {

    public boolean hasLoadErrors() {
        return raw.hasErrors() || staging.hasErrors() || warehouse.hasErrors();
    }
}
