package com.salesdw.service.quality;

import com.salesdw.model.Layer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.salesdw.service.quality.CheckClassifier.failOnIssues;
import static com.salesdw.service.quality.CheckClassifier.manyToOne;
import static com.salesdw.service.quality.CheckClassifier.warnOnIssues;
import static com.salesdw.service.quality.CheckClassifier.withinTolerance;
import static com.salesdw.service.quality.CheckMessage.always;
import static com.salesdw.service.quality.CheckMessage.averagePerKey;
import static com.salesdw.service.quality.CheckMessage.passOr;

/**
 * The staging and warehouse check batteries, in the order they run and are reported.
 */
@Component
@Slf4j
public class QualityCheckCatalog {

    static final String NULL_CHECK = "NULL_CHECK";
    static final String DUPLICATE_CHECK = "DUPLICATE_CHECK";
    static final String COUNT_VALIDATION = "COUNT_VALIDATION";
    static final String INVALID_DATE_RANGE = "INVALID_DATE_RANGE";
    static final String COMPLETENESS_CHECK = "COMPLETENESS_CHECK";

    static final String SURROGATE_KEYS = "Surrogate Keys";
    static final String REFERENTIAL_INTEGRITY = "Referential Integrity";
    static final String RELATIONSHIPS = "Relationships";
    static final String DATA_QUALITY = "Data Quality";

    private final List<QualityCheckDefinition> stagingChecks;
    private final List<QualityCheckDefinition> warehouseChecks;

    public QualityCheckCatalog(
            @Value("${app.etl.quality.count-tolerance:0.05}") BigDecimal countTolerance,
            @Value("${app.etl.quality.amount-tolerance:0.01}") BigDecimal amountTolerance) {
        this.stagingChecks = List.copyOf(buildStagingChecks(countTolerance));
        this.warehouseChecks = List.copyOf(buildWarehouseChecks(amountTolerance));
        log.info("Quality catalog: {} staging checks, {} warehouse checks (count tolerance {}, amount tolerance {})",
                stagingChecks.size(), warehouseChecks.size(), countTolerance, amountTolerance);
    }

    public List<QualityCheckDefinition> stagingChecks() {
        return stagingChecks;
    }

    public List<QualityCheckDefinition> warehouseChecks() {
        return warehouseChecks;
    }

    // ═══════════════════════════════════════════════════════════════
    // STAGING
    // ═══════════════════════════════════════════════════════════════

    private static List<QualityCheckDefinition> buildStagingChecks(BigDecimal countTolerance) {
        List<QualityCheckDefinition> checks = new ArrayList<>();

        stagingTable(checks, countTolerance, "stg_customers", "raw_customers", "customer_id",
                "customer_id IS NULL OR customer_name IS NULL",
                "Check for NULL in required fields (customer_id, customer_name)");
        stagingTable(checks, countTolerance, "stg_products", "raw_products", "product_id",
                "product_id IS NULL OR product_name IS NULL OR brand_id IS NULL OR category_id IS NULL",
                "Check for NULL in required fields");

        checks.add(staging(NULL_CHECK, "Check for NULL in required fields", "stg_orders", "quality.nullFields",
                Map.of("table", "stg_orders",
                        "predicate", "order_id IS NULL OR customer_id IS NULL OR order_date IS NULL"),
                failOnIssues(), passOr("No NULL values in required fields", "Found %1$d of %2$d rows with NULL required fields")));
        checks.add(staging(INVALID_DATE_RANGE, "Check shipped_date is not before order_date", "stg_orders",
                "quality.rowsMatching",
                Map.of("table", "stg_orders", "predicate", "shipped_date < order_date"),
                failOnIssues(), passOr("No orders shipped before they were placed",
                        "Found %1$d orders shipped before their order date")));
        checks.add(staging(INVALID_DATE_RANGE, "Check for future order/shipped dates", "stg_orders",
                "quality.rowsMatching",
                Map.of("table", "stg_orders",
                        "predicate", "order_date > CURRENT_DATE OR shipped_date > CURRENT_DATE"),
                failOnIssues(), passOr("No future order or shipped dates",
                        "Found %1$d orders with future order or shipped dates")));
        duplicateAndCount(checks, countTolerance, "stg_orders", "raw_orders", "order_id", "order_id IS NOT NULL",
                "Check for duplicate order_id");

        checks.add(staging(NULL_CHECK, "Check for NULL in required fields", "stg_order_items", "quality.nullFields",
                Map.of("table", "stg_order_items",
                        "predicate", "order_id IS NULL OR product_id IS NULL OR quantity IS NULL OR list_price IS NULL"),
                failOnIssues(), passOr("No NULL values in required fields", "Found %1$d of %2$d rows with NULL required fields")));
        duplicateAndCount(checks, countTolerance, "stg_order_items", "raw_order_items", "order_id, product_id",
                "order_id IS NOT NULL AND item_id IS NOT NULL", "Check for duplicate (order_id, product_id)");

        stagingTable(checks, countTolerance, "stg_stores", "raw_stores", "store_id",
                "store_id IS NULL OR store_name IS NULL", "Check for NULL in required fields");
        stagingTable(checks, countTolerance, "stg_staffs", "raw_staffs", "staff_id",
                "staff_id IS NULL OR staff_name IS NULL OR store_id IS NULL", "Check for NULL in required fields");

        checks.add(staging(NULL_CHECK, "Check for NULL in required fields", "stg_stocks", "quality.nullFields",
                Map.of("table", "stg_stocks",
                        "predicate", "store_id IS NULL OR product_id IS NULL OR quantity IS NULL"),
                failOnIssues(), passOr("No NULL values in required fields", "Found %1$d of %2$d rows with NULL required fields")));
        duplicateAndCount(checks, countTolerance, "stg_stocks", "raw_stocks", "store_id, product_id",
                "store_id IS NOT NULL AND product_id IS NOT NULL", "Check for duplicate (store_id, product_id)");

        stagingTable(checks, countTolerance, "stg_brands", "raw_brands", "brand_id",
                "brand_id IS NULL OR brand_name IS NULL", "Check for NULL in required fields");
        stagingTable(checks, countTolerance, "stg_categories", "raw_categories", "category_id",
                "category_id IS NULL OR category_name IS NULL", "Check for NULL in required fields");

        checks.add(completeness("Products without stock information", "stg_products", "stg_stocks", "product_id",
                "Products without stock info: %1$d out of %2$d"));
        checks.add(completeness("Orders without order items", "stg_orders", "stg_order_items", "order_id",
                "Orders without order items: %1$d out of %2$d"));
        checks.add(completeness("Stores without staff", "stg_stores", "stg_staffs", "store_id",
                "Stores without staff: %1$d out of %2$d"));
        return checks;
    }

    /**
     * NULL, duplicate key and count checks for a table keyed by a single column.
     */
    private static void stagingTable(List<QualityCheckDefinition> checks, BigDecimal countTolerance,
                                     String table, String rawTable, String key,
                                     String nullPredicate, String nullCheckName) {
        checks.add(staging(NULL_CHECK, nullCheckName, table, "quality.nullFields",
                Map.of("table", table, "predicate", nullPredicate),
                failOnIssues(), passOr("No NULL values in required fields", "Found %1$d of %2$d rows with NULL required fields")));
        duplicateAndCount(checks, countTolerance, table, rawTable, key, key + " IS NOT NULL",
                "Check for duplicate " + key);
    }

    private static void duplicateAndCount(List<QualityCheckDefinition> checks, BigDecimal countTolerance,
                                          String table, String rawTable, String keys, String rawFilter,
                                          String duplicateCheckName) {
        checks.add(staging(DUPLICATE_CHECK, duplicateCheckName, table, "quality.duplicateKeys",
                Map.of("table", table, "keys", keys),
                failOnIssues(), passOr("No duplicate keys found", "Found %1$d duplicate rows for (" + keys + ")")));
        checks.add(staging(COUNT_VALIDATION, "Raw vs staging row count", table, "quality.countValidation",
                Map.of("table", table, "rawTable", rawTable, "rawFilter", rawFilter),
                withinTolerance(countTolerance), always("%3$s")));
    }

    private static QualityCheckDefinition completeness(String name, String table, String childTable, String key,
                                                       String messageFormat) {
        return staging(COMPLETENESS_CHECK, name, table, "quality.missingChildren",
                Map.of("table", table, "childTable", childTable, "key", key),
                warnOnIssues(), always(messageFormat));
    }

    private static QualityCheckDefinition staging(String category, String name, String table, String queryName,
                                                  Map<String, String> placeholders, CheckClassifier classifier,
                                                  CheckMessage message) {
        return new QualityCheckDefinition(Layer.STAGING, category, name, table, queryName, placeholders,
                classifier, message);
    }

    // ═══════════════════════════════════════════════════════════════
    // WAREHOUSE
    // ═══════════════════════════════════════════════════════════════

    private static List<QualityCheckDefinition> buildWarehouseChecks(BigDecimal amountTolerance) {
        List<QualityCheckDefinition> checks = new ArrayList<>();

        // surrogate keys
        for (String[] dim : new String[][] {
                {"dim_customers", "customer_id"},
                {"dim_products", "product_id"},
                {"dim_stores", "store_id"},
                {"dim_staffs", "staff_id"},
                {"dim_dates", "date_id"}}) {
            checks.add(warehouse(SURROGATE_KEYS, "Primary Key Uniqueness", dim[0], "quality.primaryKeyUniqueness",
                    Map.of("table", dim[0], "key", dim[1]),
                    failOnIssues(), passOr("All " + dim[1] + " values are unique",
                            "Found %1$d duplicate " + dim[1] + " values")));
        }
        checks.add(warehouse(SURROGATE_KEYS, "NULL Primary Key Check", "dim_customers", "quality.nullFields",
                Map.of("table", "dim_customers", "predicate", "customer_id IS NULL"),
                failOnIssues(), passOr("No NULL customer_id values found", "Found %1$d NULL customer_id values")));

        // referential integrity
        checks.add(orphans("Orphaned Customer Records", "fact_sales", "dim_customers", "customer_id", "fact"));
        checks.add(orphans("Orphaned Product Records", "fact_sales", "dim_products", "product_id", "fact"));
        checks.add(orphans("Orphaned Store Records", "fact_sales", "dim_stores", "store_id", "fact"));
        checks.add(orphans("Orphaned Staff Records", "fact_sales", "dim_staffs", "staff_id", "fact"));
        checks.add(orphans("Orphaned Date Records", "fact_sales", "dim_dates", "date_id", "fact"));
        checks.add(orphans("Orphaned Product Records", "fact_inventory", "dim_products", "product_id", "inventory"));
        checks.add(orphans("Orphaned Store Records", "fact_inventory", "dim_stores", "store_id", "inventory"));
        checks.add(warehouse(REFERENTIAL_INTEGRITY, "NULL Foreign Keys", "fact_sales", "quality.factSalesNullForeignKeys",
                Map.of(), warnOnIssues(), always("%3$s")));

        // relationships
        checks.add(warehouse(RELATIONSHIPS, "Cardinality Check", "fact_sales -> dim_customers", "quality.cardinality",
                Map.of("table", "fact_sales", "key", "customer_id"),
                manyToOne(), averagePerKey("Many-to-One relationship confirmed. Avg facts per customer: ")));
        checks.add(warehouse(RELATIONSHIPS, "Unused Dimension Records", "dim_customers", "quality.unusedDimensionRows",
                Map.of("dimension", "dim_customers", "table", "fact_sales", "key", "customer_id"),
                warnOnIssues(), always("%1$d customers have no sales transactions")));
        checks.add(warehouse(RELATIONSHIPS, "Unused Products in Sales", "dim_products", "quality.unusedDimensionRows",
                Map.of("dimension", "dim_products", "table", "fact_sales", "key", "product_id"),
                warnOnIssues(), always("%1$d products have no sales transactions")));
        checks.add(warehouse(RELATIONSHIPS, "Date Dimension Continuity", "dim_dates", "quality.primaryKeyUniqueness",
                Map.of("table", "dim_dates", "key", "full_date"),
                failOnIssues(), passOr("All dates are unique, no duplicates found", "Found %1$d duplicate dates")));
        checks.add(warehouse(RELATIONSHIPS, "Staff-Store Relationship", "dim_staffs", "quality.orphans",
                Map.of("table", "dim_staffs", "dimension", "dim_stores", "key", "store_id"),
                failOnIssues(), passOr("All staff members have valid store assignments",
                        "Found %1$d staff members with invalid store_id")));

        // business rules
        checks.add(businessRule("Negative Quantities", "fact_sales", "quantity < 0", failOnIssues(),
                "No negative quantities found", "Found %1$d records with negative quantities"));
        checks.add(businessRule("Negative Prices", "fact_sales", "list_price < 0", failOnIssues(),
                "No negative prices found", "Found %1$d records with negative list_price"));
        checks.add(businessRule("Invalid Discount Values", "fact_sales", "discount < 0 OR discount > 1", failOnIssues(),
                "All discounts are in valid range (0-1)", "Found %1$d records with discount outside 0-1 range"));
        String tolerance = amountTolerance.toPlainString();
        checks.add(businessRule("Total Amount Calculation", "fact_sales",
                "ABS(total_amount - ((quantity * list_price) - (discount * quantity * list_price))) > " + tolerance,
                warnOnIssues(), "All total_amount calculations are accurate",
                "Found %1$d records with total_amount calculation variance > " + tolerance));
        checks.add(businessRule("Negative Stock Quantities", "fact_inventory", "stock_quantity < 0", warnOnIssues(),
                "No negative stock quantities found", "Found %1$d records with negative stock_quantity"));
        checks.add(grain("fact_sales", "order_id, product_id", "order_id + product_id"));
        checks.add(grain("fact_inventory", "store_id, product_id", "store_id + product_id"));
        return checks;
    }

    private static QualityCheckDefinition orphans(String name, String fact, String dimension, String key, String noun) {
        return warehouse(REFERENTIAL_INTEGRITY, name, fact, "quality.orphans",
                Map.of("table", fact, "dimension", dimension, "key", key),
                failOnIssues(), passOr("All " + key + " values have matching dimension records",
                        "Found %1$d " + noun + " records with " + key + " not in " + dimension));
    }

    private static QualityCheckDefinition businessRule(String name, String table, String predicate,
                                                       CheckClassifier classifier, String passMessage,
                                                       String issueFormat) {
        return warehouse(DATA_QUALITY, name, table, "quality.rowsMatching",
                Map.of("table", table, "predicate", predicate),
                classifier, passOr(passMessage, issueFormat));
    }

    private static QualityCheckDefinition grain(String table, String keys, String label) {
        return warehouse(DATA_QUALITY, "Fact Grain Validation", table, "quality.grainDuplicates",
                Map.of("table", table, "keys", keys),
                failOnIssues(), passOr("No duplicate grain combinations found (" + label + " is unique)",
                        "Found %1$d duplicate combinations at fact grain level"));
    }

    private static QualityCheckDefinition warehouse(String category, String name, String table, String queryName,
                                                    Map<String, String> placeholders, CheckClassifier classifier,
                                                    CheckMessage message) {
        return new QualityCheckDefinition(Layer.WAREHOUSE, category, name, table, queryName, placeholders,
                classifier, message);
    }
}
