package com.salesdw.service.quality;

import com.salesdw.model.CheckMeasurement;
import com.salesdw.model.CheckStatus;

import java.math.BigDecimal;

/**
 * Turns a check's measured numbers into PASS, FAIL or WARNING.
 */
@FunctionalInterface
public interface CheckClassifier {

    CheckStatus classify(CheckMeasurement measurement);

    /**
     * Any offending row fails the check.
     */
    static CheckClassifier failOnIssues() {
        return m -> m.issuesOrZero() == 0 ? CheckStatus.PASS : CheckStatus.FAIL;
    }

    /**
     * Offending rows are worth a look but do not fail the check.
     */
    static CheckClassifier warnOnIssues() {
        return m -> m.issuesOrZero() == 0 ? CheckStatus.PASS : CheckStatus.WARNING;
    }

    /**
     * Passes while issues stay within {@code tolerance} (a fraction) of the total rows.
     */
    static CheckClassifier withinTolerance(BigDecimal tolerance) {
        return m -> BigDecimal.valueOf(m.issuesOrZero())
                .compareTo(BigDecimal.valueOf(m.totalRows()).multiply(tolerance)) <= 0
                ? CheckStatus.PASS
                : CheckStatus.WARNING;
    }

    /**
     * Many facts per dimension key passes, exactly one per key warns, anything else fails.
     * The reference count is the number of distinct keys.
     */
    static CheckClassifier manyToOne() {
        return m -> {
            long distinctKeys = m.referenceCount() != null ? m.referenceCount() : 0L;
            if (m.totalRows() > distinctKeys) {
                return CheckStatus.PASS;
            }
            return m.totalRows() == distinctKeys ? CheckStatus.WARNING : CheckStatus.FAIL;
        };
    }
}
