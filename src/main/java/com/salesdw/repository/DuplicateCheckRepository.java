package com.salesdw.repository;

import com.salesdw.model.DuplicateCheckEntry;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class DuplicateCheckRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public DuplicateCheckRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    public void save(DuplicateCheckEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tableName", entry.tableName())
                .addValue("batchTag", entry.batchTag())
                .addValue("duplicateStatus", entry.duplicateStatus())
                .addValue("duplicateCount", entry.duplicateCount())
                .addValue("checkedAt", entry.checkedAt());
        jdbcTemplate.update(sqlLoader.load("duplicateChecker.insert"), params);
    }

    public List<DuplicateCheckEntry> findByBatchTag(String batchTag) {
        return jdbcTemplate.query(sqlLoader.load("duplicateChecker.findByBatchTag"),
                new MapSqlParameterSource("batchTag", batchTag),
                (rs, rowNum) -> {
                    Timestamp checkedAt = rs.getTimestamp("last_checked");
                    return new DuplicateCheckEntry(
                            rs.getString("table_name"),
                            rs.getString("batch_tag"),
                            rs.getLong("duplicate_count"),
                            checkedAt != null ? checkedAt.toLocalDateTime() : null);
                });
    }
}
