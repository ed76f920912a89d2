package com.salesdw.service.quality;

import com.salesdw.model.CategorySummary;
import com.salesdw.model.CheckStatus;
import com.salesdw.model.QualityCheckResult;
import com.salesdw.model.QualitySummary;
import com.salesdw.model.TableHealth;
import com.salesdw.repository.QualityCheckRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
public class QualitySummaryService {

    private final QualityCheckRepository qualityCheckRepository;

    public QualitySummary summarize(String batchTag) {
        List<QualityCheckResult> results = qualityCheckRepository.findByBatchTag(batchTag);
        return new QualitySummary(batchTag, tableHealth(results), categories(results));
    }

    /**
     * HEALTHY without failures, NEEDS ATTENTION for one or two, CRITICAL beyond that.
     * Warnings never change a table's health.
     */
    static List<TableHealth> tableHealth(List<QualityCheckResult> results) {
        List<TableHealth> health = new ArrayList<>();
        groupBy(results, QualityCheckResult::tableName).forEach((table, checks) -> {
            long failed = count(checks, CheckStatus.FAIL);
            String status = failed == 0 ? TableHealth.HEALTHY
                    : failed <= 2 ? TableHealth.NEEDS_ATTENTION
                    : TableHealth.CRITICAL;
            health.add(new TableHealth(table, checks.size(), count(checks, CheckStatus.PASS), failed,
                    count(checks, CheckStatus.WARNING), status));
        });
        return health;
    }

    static List<CategorySummary> categories(List<QualityCheckResult> results) {
        List<CategorySummary> summaries = new ArrayList<>();
        groupBy(results, QualityCheckResult::category).forEach((category, checks) -> {
            long passed = count(checks, CheckStatus.PASS);
            BigDecimal passRate = BigDecimal.valueOf(passed * 100)
                    .divide(BigDecimal.valueOf(checks.size()), 1, RoundingMode.HALF_UP);
            summaries.add(new CategorySummary(category, checks.size(), passed, count(checks, CheckStatus.FAIL),
                    count(checks, CheckStatus.WARNING), passRate));
        });
        return summaries;
    }

    private static Map<String, List<QualityCheckResult>> groupBy(List<QualityCheckResult> results,
                                                                 Function<QualityCheckResult, String> key) {
        Map<String, List<QualityCheckResult>> groups = new LinkedHashMap<>();
        for (QualityCheckResult result : results) {
            groups.computeIfAbsent(key.apply(result), k -> new ArrayList<>()).add(result);
        }
        return groups;
    }

    private static long count(List<QualityCheckResult> checks, CheckStatus status) {
        return checks.stream().filter(c -> c.status() == status).count();
    }
}
