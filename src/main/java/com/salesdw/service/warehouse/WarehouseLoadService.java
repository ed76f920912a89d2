package com.salesdw.service.warehouse;

import com.salesdw.config.BatchTagGenerator;
import com.salesdw.config.EtlMetrics;
import com.salesdw.model.DateDimensionRow;
import com.salesdw.model.Layer;
import com.salesdw.model.LayerRunResult;
import com.salesdw.model.LoadLogEntry;
import com.salesdw.repository.EtlTableRepository;
import com.salesdw.service.TableStep;
import com.salesdw.service.TableStepRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the star schema from staging: four dimensions, the generated date dimension, then both facts.
 *
 * Facts resolve their keys against whatever the dimensions hold at that point, so a failed
 * dimension shows up as orphans in the warehouse quality checks rather than stopping the load.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WarehouseLoadService {

    static final String SUCCESS_MESSAGE = "Loaded into DW";
    static final String FAILURE_PREFIX = "Load failed: ";

    private final EtlTableRepository tableRepository;
    private final DateDimensionBuilder dateDimensionBuilder;
    private final TableStepRunner stepRunner;
    private final BatchTagGenerator batchTagGenerator;
    private final EtlMetrics metrics;

    public LayerRunResult loadAll() {
        String batchTag = batchTagGenerator.next(BatchTagGenerator.WAREHOUSE_PREFIX);
        long startTime = System.currentTimeMillis();
        MDC.put("batchTag", batchTag);
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("WAREHOUSE LOAD START: batch {}", batchTag);
            log.info("═══════════════════════════════════════════════════════════════");

            List<LoadLogEntry> entries = new ArrayList<>();
            for (Map.Entry<String, TableStep> step : steps().entrySet()) {
                entries.add(stepRunner.run(Layer.WAREHOUSE, step.getKey(), batchTag, FAILURE_PREFIX,
                        step.getValue()));
            }

            long elapsed = System.currentTimeMillis() - startTime;
            metrics.recordLayerTime(Layer.WAREHOUSE, elapsed);
            LayerRunResult result = new LayerRunResult(Layer.WAREHOUSE, batchTag, List.copyOf(entries), elapsed);

            log.info("WAREHOUSE LOAD COMPLETE in {}ms | failed tables: {}", elapsed, result.failedTables());
            return result;
        } finally {
            MDC.remove("batchTag");
        }
    }

    /**
     * Load order matters: dim_dates before fact_sales, every dimension before the facts.
     */
    private Map<String, TableStep> steps() {
        Map<String, TableStep> steps = new LinkedHashMap<>();
        steps.put("dim_products", () -> reload("dim_products", "warehouse.dimProducts.insert", Collections.emptyMap()));
        steps.put("dim_customers", () -> reload("dim_customers", "warehouse.dimCustomers.insert", Collections.emptyMap()));
        steps.put("dim_stores", () -> reload("dim_stores", "warehouse.dimStores.insert", Collections.emptyMap()));
        steps.put("dim_staffs", () -> reload("dim_staffs", "warehouse.dimStaffs.insert", Collections.emptyMap()));
        steps.put("dim_dates", this::loadDates);
        steps.put("fact_sales", () -> reload("fact_sales", "warehouse.factSales.insert", Collections.emptyMap()));
        steps.put("fact_inventory", () -> reload("fact_inventory", "warehouse.factInventory.insert",
                Map.of("loadDate", batchTagGenerator.now().toLocalDate())));
        return steps;
    }

    private String reload(String table, String insertQuery, Map<String, ?> params) {
        tableRepository.truncate(table);
        int inserted = tableRepository.executeNamed(insertQuery, params);
        log.debug("  {}: {} rows inserted", table, inserted);
        return SUCCESS_MESSAGE;
    }

    private String loadDates() {
        tableRepository.truncate("dim_dates");
        List<LocalDate> orderDates = tableRepository.queryForList("warehouse.dimDates.distinctOrderDates", LocalDate.class);
        List<DateDimensionRow> rows = dateDimensionBuilder.build(orderDates);

        SqlParameterSource[] batch = rows.stream()
                .map(WarehouseLoadService::toParams)
                .toArray(SqlParameterSource[]::new);
        tableRepository.batchUpdateNamed("warehouse.dimDates.insert", batch);
        log.debug("  dim_dates: {} dates generated", rows.size());
        return SUCCESS_MESSAGE;
    }

    private static SqlParameterSource toParams(DateDimensionRow row) {
        return new MapSqlParameterSource()
                .addValue("dateId", row.dateId())
                .addValue("fullDate", row.fullDate())
                .addValue("dayOfMonth", row.dayOfMonth())
                .addValue("monthNumber", row.monthNumber())
                .addValue("monthName", row.monthName())
                .addValue("quarterNumber", row.quarterNumber())
                .addValue("yearNumber", row.yearNumber())
                .addValue("weekOfYear", row.weekOfYear());
    }
}
