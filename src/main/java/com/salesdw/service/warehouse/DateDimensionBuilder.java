package com.salesdw.service.warehouse;

import com.salesdw.model.DateDimensionRow;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.time.temporal.WeekFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Builds dim_dates rows from the calendar dates sales happened on.
 *
 * Weeks start on Sunday and week 1 begins on the year's first Sunday; earlier days fall in week 0.
 */
@Component
public class DateDimensionBuilder {

    private static final WeekFields SUNDAY_WEEKS = WeekFields.of(DayOfWeek.SUNDAY, 7);

    /**
     * @param dates order dates, in any order and possibly repeated
     * @return one row per distinct date, ascending, with date_id 1..n
     */
    public List<DateDimensionRow> build(List<LocalDate> dates) {
        List<DateDimensionRow> rows = new ArrayList<>();
        int dateId = 1;
        for (LocalDate date : new TreeSet<>(dates)) {
            rows.add(toRow(dateId++, date));
        }
        return rows;
    }

    DateDimensionRow toRow(int dateId, LocalDate date) {
        return new DateDimensionRow(
                dateId,
                date,
                date.getDayOfMonth(),
                date.getMonthValue(),
                date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                (date.getMonthValue() - 1) / 3 + 1,
                date.getYear(),
                date.get(SUNDAY_WEEKS.weekOfYear()));
    }
}
