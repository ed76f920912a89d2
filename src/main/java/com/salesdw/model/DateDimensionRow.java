package com.salesdw.model;

import java.time.LocalDate;

/**
 * Generated row of dim_dates.
 */
public record DateDimensionRow(
    int dateId,
    LocalDate fullDate,
    int dayOfMonth,
    int monthNumber,
    String monthName,
    int quarterNumber,
    int yearNumber,
    int weekOfYear
) {}
