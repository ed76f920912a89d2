package com.salesdw.model;

import java.util.List;

/**
 * Roll-up of one quality batch by table and by category.
 */
public record QualitySummary(
    String batchTag,
    List<TableHealth> tables,
    List<CategorySummary> categories
) {}
