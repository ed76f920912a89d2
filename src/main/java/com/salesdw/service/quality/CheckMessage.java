package com.salesdw.service.quality;

import com.salesdw.model.CheckMeasurement;
import com.salesdw.model.CheckStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Builds the human readable message stored with a check result.
 *
 * Format strings receive the issue count as {@code %1$d}, the total rows as {@code %2$d}
 * and the query's detail column as {@code %3$s}.
 */
@FunctionalInterface
public interface CheckMessage {

    String render(CheckMeasurement measurement, CheckStatus status);

    /**
     * Fixed text when the check passes, formatted issue text otherwise.
     */
    static CheckMessage passOr(String passMessage, String issueFormat) {
        return (m, status) -> status == CheckStatus.PASS ? passMessage : format(issueFormat, m);
    }

    /**
     * The same formatted text whatever the outcome.
     */
    static CheckMessage always(String format) {
        return (m, status) -> format(format, m);
    }

    /**
     * Average facts per distinct dimension key, for cardinality checks.
     */
    static CheckMessage averagePerKey(String prefix) {
        return (m, status) -> {
            Long keys = m.referenceCount();
            String average = keys == null || keys == 0
                    ? "n/a"
                    : BigDecimal.valueOf(m.totalRows())
                            .divide(BigDecimal.valueOf(keys), 2, RoundingMode.HALF_UP)
                            .toPlainString();
            return prefix + average;
        };
    }

    private static String format(String format, CheckMeasurement m) {
        return String.format(format, m.issuesOrZero(), m.totalRows(), m.detail() != null ? m.detail() : "");
    }
}
