package com.company.podwatch.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table level housekeeping: row counts and storage reclaim after pruning
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class StorageStatisticsRepository {

    public static final List<String> TABLES = List.of(
            "resource_status", "resource_ports", "node_stats", "status_history", "image_history",
            "metric_samples", "alert_records", "delivery_outcomes");

    private final JdbcTemplate jdbcTemplate;

    @Value("${podwatch.retention.reclaim-statement:VACUUM ANALYZE}")
    private String reclaimStatement;

    public Map<String, Long> rowCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String table : TABLES) {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
            counts.put(table, count != null ? count : 0L);
        }
        return counts;
    }

    /**
     * Runs the configured reclaim statement. Returns false (and logs) when it fails; deleted rows stay deleted.
     */
    public boolean reclaim() {
        if (reclaimStatement == null || reclaimStatement.isBlank()) {
            return true;
        }
        try {
            jdbcTemplate.execute(reclaimStatement);
            log.info("Storage reclaim completed ({})", reclaimStatement);
            return true;
        } catch (Exception e) {
            log.warn("Storage reclaim '{}' failed", reclaimStatement, e);
            return false;
        }
    }
}
