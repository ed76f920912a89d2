package com.salesdw.service.staging;

import java.util.List;

/**
 * Staging tables in transform order, each with the raw table it is cleaned from and its natural key.
 */
public enum StagingTable {
    BRANDS("stg_brands", "raw_brands", List.of("brand_id"), "staging.brands.insert"),
    CATEGORIES("stg_categories", "raw_categories", List.of("category_id"), "staging.categories.insert"),
    PRODUCTS("stg_products", "raw_products", List.of("product_id"), "staging.products.insert"),
    CUSTOMERS("stg_customers", "raw_customers", List.of("customer_id"), "staging.customers.insert"),
    ORDERS("stg_orders", "raw_orders", List.of("order_id"), "staging.orders.insert"),
    ORDER_ITEMS("stg_order_items", "raw_order_items", List.of("order_id", "item_id"), "staging.orderItems.insert"),
    STORES("stg_stores", "raw_stores", List.of("store_id"), "staging.stores.insert"),
    STAFFS("stg_staffs", "raw_staffs", List.of("staff_id"), "staging.staffs.insert"),
    STOCKS("stg_stocks", "raw_stocks", List.of("store_id", "product_id"), "staging.stocks.insert");

    private final String tableName;
    private final String rawTable;
    private final List<String> keyColumns;
    private final String insertQuery;

    StagingTable(String tableName, String rawTable, List<String> keyColumns, String insertQuery) {
        this.tableName = tableName;
        this.rawTable = rawTable;
        this.keyColumns = keyColumns;
        this.insertQuery = insertQuery;
    }

    public String tableName() {
        return tableName;
    }

    public String rawTable() {
        return rawTable;
    }

    public List<String> keyColumns() {
        return keyColumns;
    }

    public String insertQuery() {
        return insertQuery;
    }

    /**
     * Comma separated key list, e.g. {@code order_id, item_id}.
     */
    public String keyList() {
        return String.join(", ", keyColumns);
    }

    /**
     * Predicate keeping raw rows whose key columns are all present.
     */
    public String keyFilter() {
        return String.join(" AND ", keyColumns.stream().map(c -> c + " IS NOT NULL").toList());
    }
}
