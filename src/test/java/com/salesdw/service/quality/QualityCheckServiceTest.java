package com.salesdw.service.quality;

import com.salesdw.model.CheckStatus;
import com.salesdw.model.Layer;
import com.salesdw.model.QualityCheckResult;
import com.salesdw.model.QualityRunResult;
import com.salesdw.support.EtlTestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QualityCheckServiceTest {

    private EtlTestDatabase db;
    private QualityCheckService service;

    @BeforeEach
    void setUp() throws Exception {
        db = new EtlTestDatabase();
        db.rawLoadService().loadAll();
        db.stagingTransformService().transformAll();
        db.warehouseLoadService().loadAll();
        service = db.qualityCheckService();
    }

    @Test
    @DisplayName("Should flag the sale whose customer is missing from staging as an orphan")
    void shouldFailOrphanedCustomerCheck() {
        // When
        QualityRunResult run = service.runWarehouseChecks();

        // Then
        QualityCheckResult orphans = find(run, "Orphaned Customer Records", "fact_sales");
        assertThat(orphans.status()).isEqualTo(CheckStatus.FAIL);
        assertThat(orphans.issueCount()).isEqualTo(1L);
        assertThat(orphans.totalRows()).isEqualTo(5);
        assertThat(orphans.issuePercentage()).isEqualByComparingTo("20.00");
        assertThat(orphans.message()).isEqualTo("Found 1 fact records with customer_id not in dim_customers");

        assertThat(find(run, "Orphaned Product Records", "fact_sales").status()).isEqualTo(CheckStatus.PASS);
        assertThat(find(run, "Orphaned Date Records", "fact_sales").status()).isEqualTo(CheckStatus.PASS);
    }

    @Test
    @DisplayName("Should store every warehouse result under one batch tag")
    void shouldPersistWarehouseResults() {
        QualityRunResult run = service.runWarehouseChecks();

        assertThat(run.batchTag()).isEqualTo("DWQualityCheck_20240501_134502");
        assertThat(run.results()).hasSize(26);
        assertThat(run.results()).extracting(QualityCheckResult::layer).containsOnly(Layer.WAREHOUSE);

        List<QualityCheckResult> stored = db.qualityCheckRepository.findByBatchTag(run.batchTag());
        assertThat(stored).hasSize(26);
        assertThat(stored).extracting(QualityCheckResult::checkName)
                .containsExactlyElementsOf(run.results().stream().map(QualityCheckResult::checkName).toList());
    }

    @Test
    @DisplayName("Should pass business rules on clean data")
    void shouldPassBusinessRulesOnCleanData() {
        QualityRunResult run = service.runWarehouseChecks();

        for (String name : List.of("Negative Quantities", "Negative Prices", "Invalid Discount Values",
                "Total Amount Calculation")) {
            assertThat(find(run, name, "fact_sales").status()).as(name).isEqualTo(CheckStatus.PASS);
        }
        assertThat(find(run, "Fact Grain Validation", "fact_sales").status()).isEqualTo(CheckStatus.PASS);
        assertThat(find(run, "Fact Grain Validation", "fact_inventory").status()).isEqualTo(CheckStatus.PASS);
        assertThat(find(run, "Primary Key Uniqueness", "dim_customers").status()).isEqualTo(CheckStatus.PASS);
    }

    @Test
    @DisplayName("Should fail negative quantities and out-of-range discounts")
    void shouldFailBrokenBusinessRules() {
        // Given
        db.jdbc().update("UPDATE fact_sales SET quantity = -1 WHERE order_id = 3");
        db.jdbc().update("UPDATE fact_sales SET discount = 1.5 WHERE order_id = 2");

        // When
        QualityRunResult run = service.runWarehouseChecks();

        // Then
        QualityCheckResult quantities = find(run, "Negative Quantities", "fact_sales");
        assertThat(quantities.status()).isEqualTo(CheckStatus.FAIL);
        assertThat(quantities.issueCount()).isEqualTo(1L);
        assertThat(find(run, "Invalid Discount Values", "fact_sales").status()).isEqualTo(CheckStatus.FAIL);
        // stored total_amount no longer matches the recomputed one
        assertThat(find(run, "Total Amount Calculation", "fact_sales").status()).isEqualTo(CheckStatus.WARNING);
    }

    @Test
    @DisplayName("Should fail negative prices and repeated grain, warn on negative stock and null keys")
    void shouldFlagPriceGrainStockAndNullKeyViolations() {
        // Given
        db.jdbc().update("UPDATE fact_sales SET list_price = -1, staff_id = NULL WHERE order_id = 2");
        db.jdbc().update("INSERT INTO fact_sales (order_id, item_id, customer_id, product_id, store_id, staff_id,"
                + " date_id, quantity, list_price, sales, discount, total_amount)"
                + " SELECT order_id, item_id + 1, customer_id, product_id, store_id, staff_id,"
                + " date_id, quantity, list_price, sales, discount, total_amount FROM fact_sales WHERE order_id = 3");
        db.jdbc().update("UPDATE fact_inventory SET stock_quantity = -3 WHERE store_id = 1 AND product_id = 1");

        // When
        QualityRunResult run = service.runWarehouseChecks();

        // Then
        QualityCheckResult prices = find(run, "Negative Prices", "fact_sales");
        assertThat(prices.status()).isEqualTo(CheckStatus.FAIL);
        assertThat(prices.issueCount()).isEqualTo(1L);
        assertThat(prices.totalRows()).isEqualTo(6);
        assertThat(prices.message()).isEqualTo("Found 1 records with negative list_price");

        QualityCheckResult salesGrain = find(run, "Fact Grain Validation", "fact_sales");
        assertThat(salesGrain.status()).isEqualTo(CheckStatus.FAIL);
        assertThat(salesGrain.issueCount()).isEqualTo(1L);
        assertThat(salesGrain.message()).isEqualTo("Found 1 duplicate combinations at fact grain level");
        assertThat(find(run, "Fact Grain Validation", "fact_inventory").status()).isEqualTo(CheckStatus.PASS);

        QualityCheckResult stock = find(run, "Negative Stock Quantities", "fact_inventory");
        assertThat(stock.status()).isEqualTo(CheckStatus.WARNING);
        assertThat(stock.issueCount()).isEqualTo(1L);
        assertThat(stock.message()).isEqualTo("Found 1 records with negative stock_quantity");

        QualityCheckResult nullKeys = find(run, "NULL Foreign Keys", "fact_sales");
        assertThat(nullKeys.status()).isEqualTo(CheckStatus.WARNING);
        assertThat(nullKeys.issueCount()).isEqualTo(1L);
        assertThat(nullKeys.message()).isEqualTo("NULL FKs - Customer: 0, Product: 0, Store: 0, Staff: 1, Date: 0");
    }

    @Test
    @DisplayName("Should record a check with an unknown query as FAIL and run the next one")
    void shouldRecordUnknownQueryAsFail() {
        // Given
        QualityCheckDefinition broken = new QualityCheckDefinition(Layer.WAREHOUSE, "Data Quality",
                "Broken Check", "fact_sales", "quality.doesNotExist", Map.of(),
                CheckClassifier.failOnIssues(), CheckMessage.passOr("ok", "Found %1$d"));
        QualityCheckDefinition negativeQuantities = new QualityCheckCatalog(new BigDecimal("0.05"), new BigDecimal("0.01"))
                .warehouseChecks().stream()
                .filter(c -> c.checkName().equals("Negative Quantities"))
                .findFirst().orElseThrow();

        // When
        QualityRunResult run = service.runChecks(Layer.WAREHOUSE, "DWQualityCheck",
                List.of(broken, negativeQuantities));

        // Then
        assertThat(run.results()).hasSize(2);
        QualityCheckResult failed = run.results().get(0);
        assertThat(failed.status()).isEqualTo(CheckStatus.FAIL);
        assertThat(failed.issueCount()).isNull();
        assertThat(failed.message()).startsWith("Check query failed: ").contains("quality.doesNotExist");
        assertThat(run.results().get(1).status()).isEqualTo(CheckStatus.PASS);
        assertThat(db.qualityCheckRepository.findByBatchTag(run.batchTag())).hasSize(2);
    }

    @Test
    @DisplayName("Should classify relationship checks")
    void shouldClassifyRelationships() {
        QualityRunResult run = service.runWarehouseChecks();

        QualityCheckResult cardinality = find(run, "Cardinality Check", "fact_sales -> dim_customers");
        assertThat(cardinality.status()).isEqualTo(CheckStatus.PASS);
        assertThat(cardinality.issueCount()).isNull();
        assertThat(cardinality.issuePercentage()).isNull();
        assertThat(cardinality.message()).isEqualTo("Many-to-One relationship confirmed. Avg facts per customer: 1.25");

        assertThat(find(run, "Unused Dimension Records", "dim_customers").status()).isEqualTo(CheckStatus.PASS);
        assertThat(find(run, "Staff-Store Relationship", "dim_staffs").status()).isEqualTo(CheckStatus.PASS);
    }

    @Test
    @DisplayName("Should record a check whose query fails as FAIL and keep going")
    void shouldRecordFailedQueryAsFail() {
        // Given
        db.jdbc().execute("DROP TABLE fact_inventory");

        // When
        QualityRunResult run = service.runWarehouseChecks();

        // Then
        QualityCheckResult stockCheck = find(run, "Negative Stock Quantities", "fact_inventory");
        assertThat(stockCheck.status()).isEqualTo(CheckStatus.FAIL);
        assertThat(stockCheck.message()).startsWith("Check query failed: ");
        assertThat(run.results()).hasSize(26);
        assertThat(find(run, "Negative Quantities", "fact_sales").status()).isEqualTo(CheckStatus.PASS);
    }

    @Test
    @DisplayName("Should run the staging battery and flag the customer count difference")
    void shouldRunStagingChecks() {
        QualityRunResult run = service.runStagingChecks();

        assertThat(run.batchTag()).isEqualTo("StgQualityCheck_20240501_134502");
        assertThat(run.results()).extracting(QualityCheckResult::layer).containsOnly(Layer.STAGING);

        QualityCheckResult customerCount = run.results().stream()
                .filter(r -> r.tableName().equals("stg_customers") && r.category().equals("COUNT_VALIDATION"))
                .findFirst().orElseThrow();
        assertThat(customerCount.status()).isEqualTo(CheckStatus.WARNING);
        assertThat(customerCount.message()).isEqualTo("Raw count: 4, Staging count: 3");
        assertThat(customerCount.issueCount()).isEqualTo(1L);

        assertThat(run.results())
                .filteredOn(r -> r.category().equals("DUPLICATE_CHECK"))
                .extracting(QualityCheckResult::status)
                .containsOnly(CheckStatus.PASS);
        assertThat(run.results())
                .filteredOn(r -> r.category().equals("INVALID_DATE_RANGE"))
                .extracting(QualityCheckResult::status)
                .containsOnly(CheckStatus.PASS);
    }

    @Test
    @DisplayName("Should warn when staging rows have no children")
    void shouldWarnOnIncompleteStaging() {
        db.jdbc().update("DELETE FROM stg_order_items WHERE order_id = 3");

        QualityRunResult run = service.runStagingChecks();

        QualityCheckResult orphanOrders = run.results().stream()
                .filter(r -> r.checkName().equals("Orders without order items"))
                .findFirst().orElseThrow();
        assertThat(orphanOrders.status()).isEqualTo(CheckStatus.WARNING);
        assertThat(orphanOrders.message()).isEqualTo("Orders without order items: 1 out of 4");
    }

    @Test
    void issuePercentage_shouldRoundToTwoDecimals() {
        assertThat(QualityCheckService.issuePercentage(1L, 3)).isEqualByComparingTo(new BigDecimal("33.33"));
        assertThat(QualityCheckService.issuePercentage(1L, 0)).isNull();
        assertThat(QualityCheckService.issuePercentage(null, 10)).isNull();
    }

    private static QualityCheckResult find(QualityRunResult run, String checkName, String tableName) {
        return run.results().stream()
                .filter(r -> r.checkName().equals(checkName) && r.tableName().equals(tableName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No result for " + Map.of(checkName, tableName)));
    }
}
