package com.salesdw.service.warehouse;

import com.salesdw.model.DateDimensionRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DateDimensionBuilderTest {

    private final DateDimensionBuilder builder = new DateDimensionBuilder();

    @Test
    @DisplayName("Should assign dense ids to distinct dates in ascending order")
    void shouldAssignDenseIdsToDistinctDates() {
        List<DateDimensionRow> rows = builder.build(List.of(
                LocalDate.of(2016, 1, 5),
                LocalDate.of(2016, 1, 1),
                LocalDate.of(2016, 1, 5),
                LocalDate.of(2016, 1, 3)));

        assertThat(rows).extracting(DateDimensionRow::dateId).containsExactly(1, 2, 3);
        assertThat(rows).extracting(DateDimensionRow::fullDate).containsExactly(
                LocalDate.of(2016, 1, 1), LocalDate.of(2016, 1, 3), LocalDate.of(2016, 1, 5));
    }

    @Test
    @DisplayName("Should derive calendar attributes")
    void shouldDeriveCalendarAttributes() {
        DateDimensionRow row = builder.build(List.of(LocalDate.of(2017, 8, 15))).get(0);

        assertThat(row.dayOfMonth()).isEqualTo(15);
        assertThat(row.monthNumber()).isEqualTo(8);
        assertThat(row.monthName()).isEqualTo("August");
        assertThat(row.quarterNumber()).isEqualTo(3);
        assertThat(row.yearNumber()).isEqualTo(2017);
    }

    @Test
    @DisplayName("Should count Sunday-start weeks with days before the first Sunday in week 0")
    void shouldUseSundayStartWeeks() {
        // 2016-01-01 is a Friday, 2016-01-03 the first Sunday
        assertThat(builder.toRow(1, LocalDate.of(2016, 1, 1)).weekOfYear()).isZero();
        assertThat(builder.toRow(1, LocalDate.of(2016, 1, 2)).weekOfYear()).isZero();
        assertThat(builder.toRow(1, LocalDate.of(2016, 1, 3)).weekOfYear()).isEqualTo(1);
        assertThat(builder.toRow(1, LocalDate.of(2016, 1, 9)).weekOfYear()).isEqualTo(1);
        assertThat(builder.toRow(1, LocalDate.of(2016, 1, 10)).weekOfYear()).isEqualTo(2);
        // 2017-01-01 is a Sunday
        assertThat(builder.toRow(1, LocalDate.of(2017, 1, 1)).weekOfYear()).isEqualTo(1);
        assertThat(builder.toRow(1, LocalDate.of(2018, 12, 31)).weekOfYear()).isEqualTo(52);
    }

    @Test
    @DisplayName("Should map quarter boundaries")
    void shouldMapQuarters() {
        assertThat(builder.toRow(1, LocalDate.of(2018, 3, 31)).quarterNumber()).isEqualTo(1);
        assertThat(builder.toRow(1, LocalDate.of(2018, 4, 1)).quarterNumber()).isEqualTo(2);
        assertThat(builder.toRow(1, LocalDate.of(2018, 12, 31)).quarterNumber()).isEqualTo(4);
    }

    @Test
    void shouldReturnNoRowsForNoDates() {
        assertThat(builder.build(List.of())).isEmpty();
    }
}
