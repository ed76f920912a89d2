package com.salesdw.repository;

import com.salesdw.model.CheckMeasurement;
import com.salesdw.model.CheckStatus;
import com.salesdw.model.Layer;
import com.salesdw.model.QualityCheckResult;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Runs quality check queries and stores their classified results.
 */
@Repository
public class QualityCheckRepository {

    private static final RowMapper<QualityCheckResult> RESULT_MAPPER = (rs, rowNum) -> {
        Timestamp checkedAt = rs.getTimestamp("checked_at");
        return new QualityCheckResult(
                Layer.valueOf(rs.getString("pipeline_layer")),
                rs.getString("check_category"),
                rs.getString("check_name"),
                rs.getString("table_name"),
                CheckStatus.valueOf(rs.getString("test_result")),
                rs.getLong("total_rows"),
                nullableLong(rs, "issue_count"),
                rs.getBigDecimal("issue_percentage"),
                rs.getString("message"),
                rs.getString("batch_tag"),
                checkedAt != null ? checkedAt.toLocalDateTime() : null);
    };

    /**
     * Reads the single row every check query returns. Optional columns are detected by label.
     */
    private static final ResultSetExtractor<CheckMeasurement> MEASUREMENT_EXTRACTOR = rs -> {
        if (!rs.next()) {
            return new CheckMeasurement(0L, 0L, null, null);
        }
        Set<String> labels = columnLabels(rs.getMetaData());
        return new CheckMeasurement(
                rs.getLong("total_rows"),
                labels.contains("issue_count") ? nullableLong(rs, "issue_count") : null,
                labels.contains("reference_count") ? nullableLong(rs, "reference_count") : null,
                labels.contains("detail") ? rs.getString("detail") : null);
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public QualityCheckRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    public CheckMeasurement measure(String sql) {
        return jdbcTemplate.getJdbcTemplate().query(sql, MEASUREMENT_EXTRACTOR);
    }

    public void save(QualityCheckResult result) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("layer", result.layer().name())
                .addValue("category", result.category())
                .addValue("checkName", result.checkName())
                .addValue("tableName", result.tableName())
                .addValue("status", result.status().name())
                .addValue("totalRows", result.totalRows())
                .addValue("issueCount", result.issueCount())
                .addValue("issuePercentage", result.issuePercentage())
                .addValue("message", result.message())
                .addValue("batchTag", result.batchTag())
                .addValue("checkedAt", result.checkedAt());
        jdbcTemplate.update(sqlLoader.load("qualityResults.insert"), params);
    }

    public List<QualityCheckResult> findByBatchTag(String batchTag) {
        return jdbcTemplate.query(sqlLoader.load("qualityResults.findByBatchTag"),
                new MapSqlParameterSource("batchTag", batchTag), RESULT_MAPPER);
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Set<String> columnLabels(ResultSetMetaData metaData) throws SQLException {
        Set<String> labels = new HashSet<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            labels.add(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return labels;
    }
}
