package com.salesdw.service.quality;

import com.salesdw.model.CategorySummary;
import com.salesdw.model.CheckStatus;
import com.salesdw.model.Layer;
import com.salesdw.model.QualityCheckResult;
import com.salesdw.model.QualitySummary;
import com.salesdw.model.TableHealth;
import com.salesdw.repository.QualityCheckRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QualitySummaryServiceTest {

    @Mock private QualityCheckRepository qualityCheckRepository;
    @InjectMocks private QualitySummaryService summaryService;

    @Test
    @DisplayName("Should grade tables by their number of failed checks")
    void shouldGradeTableHealth() {
        // Given
        List<QualityCheckResult> results = new ArrayList<>();
        results.add(result("dim_customers", "Surrogate Keys", CheckStatus.PASS));
        results.add(result("dim_customers", "Relationships", CheckStatus.WARNING));
        results.add(result("dim_dates", "Surrogate Keys", CheckStatus.FAIL));
        for (int i = 0; i < 3; i++) {
            results.add(result("fact_sales", "Data Quality", CheckStatus.FAIL));
        }
        when(qualityCheckRepository.findByBatchTag("DWQualityCheck_1")).thenReturn(results);

        // When
        QualitySummary summary = summaryService.summarize("DWQualityCheck_1");

        // Then
        assertThat(summary.tables()).extracting(TableHealth::tableName, TableHealth::status).containsExactly(
                org.assertj.core.groups.Tuple.tuple("dim_customers", TableHealth.HEALTHY),
                org.assertj.core.groups.Tuple.tuple("dim_dates", TableHealth.NEEDS_ATTENTION),
                org.assertj.core.groups.Tuple.tuple("fact_sales", TableHealth.CRITICAL));
        TableHealth customers = summary.tables().get(0);
        assertThat(customers.totalChecks()).isEqualTo(2);
        assertThat(customers.warnings()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should compute the pass rate per category")
    void shouldSummarizeCategories() {
        List<QualityCheckResult> results = List.of(
                result("dim_customers", "Surrogate Keys", CheckStatus.PASS),
                result("dim_products", "Surrogate Keys", CheckStatus.PASS),
                result("dim_dates", "Surrogate Keys", CheckStatus.FAIL),
                result("fact_sales", "Data Quality", CheckStatus.WARNING));

        List<CategorySummary> categories = QualitySummaryService.categories(results);

        assertThat(categories).hasSize(2);
        CategorySummary keys = categories.get(0);
        assertThat(keys.category()).isEqualTo("Surrogate Keys");
        assertThat(keys.passed()).isEqualTo(2);
        assertThat(keys.failed()).isEqualTo(1);
        assertThat(keys.passRate()).isEqualByComparingTo("66.7");
        assertThat(categories.get(1).passRate()).isEqualByComparingTo("0.0");
    }

    @Test
    void shouldReturnEmptySummaryForUnknownBatch() {
        when(qualityCheckRepository.findByBatchTag("nope")).thenReturn(List.of());

        QualitySummary summary = summaryService.summarize("nope");

        assertThat(summary.tables()).isEmpty();
        assertThat(summary.categories()).isEmpty();
    }

    private static QualityCheckResult result(String table, String category, CheckStatus status) {
        return new QualityCheckResult(Layer.WAREHOUSE, category, "check", table, status, 10, 0L, null,
                "message", "DWQualityCheck_1", null);
    }
}
