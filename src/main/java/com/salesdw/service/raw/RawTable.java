package com.salesdw.service.raw;

import java.util.List;

/**
 * Raw tables in load order, with the source file each one mirrors and its column order.
 */
public enum RawTable {
    BRANDS("raw_brands", "brands.csv",
            List.of("brand_id", "brand_name")),
    CATEGORIES("raw_categories", "categories.csv",
            List.of("category_id", "category_name")),
    PRODUCTS("raw_products", "products.csv",
            List.of("product_id", "product_name", "brand_id", "category_id", "model_year", "list_price")),
    CUSTOMERS("raw_customers", "customers.csv",
            List.of("customer_id", "first_name", "last_name", "phone", "email", "street", "city", "state", "zip_code")),
    ORDERS("raw_orders", "orders.csv",
            List.of("order_id", "customer_id", "order_status", "order_date", "required_date", "shipped_date",
                    "store_id", "staff_id")),
    ORDER_ITEMS("raw_order_items", "order_items.csv",
            List.of("order_id", "item_id", "product_id", "quantity", "list_price", "discount")),
    STORES("raw_stores", "stores.csv",
            List.of("store_id", "store_name", "phone", "email", "street", "city", "state", "zip_code")),
    STAFFS("raw_staffs", "staffs.csv",
            List.of("staff_id", "first_name", "last_name", "email", "phone", "active", "store_id", "manager_id")),
    STOCKS("raw_stocks", "stocks.csv",
            List.of("store_id", "product_id", "quantity"));

    private final String tableName;
    private final String fileName;
    private final List<String> columns;

    RawTable(String tableName, String fileName, List<String> columns) {
        this.tableName = tableName;
        this.fileName = fileName;
        this.columns = columns;
    }

    public String tableName() {
        return tableName;
    }

    public String fileName() {
        return fileName;
    }

    public List<String> columns() {
        return columns;
    }
}
