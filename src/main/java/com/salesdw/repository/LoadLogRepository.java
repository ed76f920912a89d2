package com.salesdw.repository;

import com.salesdw.model.Layer;
import com.salesdw.model.LoadLogEntry;
import com.salesdw.model.LoadStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

/**
 * Append-only access to the load_log table shared by every layer.
 */
@Repository
@Slf4j
public class LoadLogRepository {

    private static final RowMapper<LoadLogEntry> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp loadTime = rs.getTimestamp("load_time");
        return new LoadLogEntry(
                Layer.valueOf(rs.getString("pipeline_layer")),
                rs.getString("table_name"),
                rs.getString("batch_tag"),
                LoadStatus.valueOf(rs.getString("load_status")),
                rs.getString("message"),
                loadTime != null ? loadTime.toLocalDateTime() : null);
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public LoadLogRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    public void save(LoadLogEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("layer", entry.layer().name())
                .addValue("tableName", entry.tableName())
                .addValue("batchTag", entry.batchTag())
                .addValue("status", entry.status().name())
                .addValue("message", entry.message())
                .addValue("loadTime", entry.loadTime());
        jdbcTemplate.update(sqlLoader.load("loadLog.insert"), params);
    }

    public List<LoadLogEntry> findByBatchTag(String batchTag) {
        return jdbcTemplate.query(sqlLoader.load("loadLog.findByBatchTag"),
                new MapSqlParameterSource("batchTag", batchTag), ROW_MAPPER);
    }

    /**
     * Most recent entries first, across all batches.
     */
    public List<LoadLogEntry> findRecent(int limit) {
        return jdbcTemplate.query(sqlLoader.load("loadLog.findRecent"),
                new MapSqlParameterSource("limit", limit), ROW_MAPPER);
    }
}
