package com.salesdw.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Set-based statements against the raw, staging and warehouse tables.
 *
 * Every method lets Spring's {@link org.springframework.dao.DataAccessException} propagate;
 * the layer services decide whether a failure stops a table.
 */
@Repository
@Slf4j
public class EtlTableRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    /**
     * Maximum rows per JDBC batch when inserting parsed source rows.
     */
    private final int batchSize;

    public EtlTableRepository(
            NamedParameterJdbcTemplate jdbcTemplate,
            SqlTemplateLoader sqlLoader,
            @Value("${app.etl.insert-batch-size:1000}") int batchSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
        this.batchSize = batchSize;
        log.info("EtlTableRepository initialized with insert batch size: {}", batchSize);
    }

    public void truncate(String table) {
        jdbcTemplate.getJdbcTemplate().execute(sqlLoader.render("generic.truncate", Map.of("table", table)));
    }

    public long count(String table) {
        Long count = jdbcTemplate.getJdbcTemplate()
                .queryForObject(sqlLoader.render("generic.count", Map.of("table", table)), Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Run a named INSERT ... SELECT / UPDATE statement.
     *
     * @return affected row count
     */
    public int executeNamed(String queryName, Map<String, ?> params) {
        return jdbcTemplate.update(sqlLoader.load(queryName), new MapSqlParameterSource(params));
    }

    /**
     * Run a rendered template returning a single number (duplicate counts).
     */
    public long queryForLong(String queryName, Map<String, String> placeholders) {
        Long value = jdbcTemplate.getJdbcTemplate()
                .queryForObject(sqlLoader.render(queryName, placeholders), Long.class);
        return value != null ? value : 0L;
    }

    public <T> List<T> queryForList(String queryName, Class<T> elementType) {
        return jdbcTemplate.queryForList(sqlLoader.load(queryName), Collections.emptyMap(), elementType);
    }

    public int[] batchUpdateNamed(String queryName, SqlParameterSource[] batch) {
        if (batch.length == 0) {
            return new int[0];
        }
        return jdbcTemplate.batchUpdate(sqlLoader.load(queryName), batch);
    }

    /**
     * Insert positional rows into a table, chunked by the configured batch size.
     *
     * @return total rows inserted
     */
    public int insertRows(String table, List<String> columns, List<Object[]> rows) {
        if (rows.isEmpty()) {
            return 0;
        }

        String sql = sqlLoader.render("generic.insert", Map.of(
                "table", table,
                "columns", String.join(", ", columns),
                "placeholders", String.join(", ", Collections.nCopies(columns.size(), "?"))));

        List<List<Object[]>> parts = partition(rows, batchSize);
        int inserted = 0;
        int chunkNum = 1;
        for (List<Object[]> chunk : parts) {
            log.debug("insertRows({}): chunk {}/{} ({} rows)", table, chunkNum, parts.size(), chunk.size());
            for (int n : jdbcTemplate.getJdbcTemplate().batchUpdate(sql, chunk)) {
                inserted += n >= 0 ? n : 1;
            }
            chunkNum++;
        }
        return inserted;
    }

    /**
     * Partition a list into chunks of specified size.
     */
    private <T> List<List<T>> partition(List<T> list, int size) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            partitions.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return partitions;
    }
}
