package com.salesdw;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sales Warehouse ETL Application.
 *
 * Loads the source CSV files through raw and staging tables into a star schema and checks
 * each layer. Runs are triggered over REST, see EtlController.
 */
@SpringBootApplication
public class SalesWarehouseEtlApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesWarehouseEtlApplication.class, args);
    }
}
