package com.company.podwatch.repository;

import com.company.podwatch.domain.MetricSample;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.enums.ResourceKind;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class MetricSampleRepository {

    private final JdbcTemplate jdbcTemplate;

    public int[] saveAll(List<MetricSample> samples) {
        String sql = """
            INSERT INTO metric_samples (kind, namespace, name, cpu_millicores, memory_bytes, disk_percent, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        List<Object[]> batch = new ArrayList<>(samples.size());
        for (MetricSample s : samples) {
            Instant capturedAt = s.getCapturedAt() != null ? s.getCapturedAt() : Instant.now();
            batch.add(new Object[]{
                    s.getKind().name(),
                    new ResourceKey(s.getKind(), s.getNamespace(), s.getName()).getNamespace(),
                    s.getName(), s.getCpuMillicores(), s.getMemoryBytes(), s.getDiskPercent(),
                    Timestamp.from(capturedAt)
            });
        }
        return jdbcTemplate.batchUpdate(sql, batch);
    }

    /**
     * Samples captured at or after {@code since}, oldest first
     */
    public List<MetricSample> findByKeySince(ResourceKey key, Instant since) {
        String sql = """
            SELECT kind, namespace, name, cpu_millicores, memory_bytes, disk_percent, created_at
            FROM metric_samples
            WHERE kind = ? AND namespace = ? AND name = ? AND created_at >= ?
            ORDER BY created_at ASC
            """;
        return jdbcTemplate.query(sql, new MetricSampleRowMapper(),
                key.getKind().name(), key.getNamespace(), key.getName(), Timestamp.from(since));
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM metric_samples WHERE created_at < ?", Timestamp.from(cutoff));
    }

    private static class MetricSampleRowMapper implements RowMapper<MetricSample> {
        @Override
        public MetricSample mapRow(ResultSet rs, int rowNum) throws SQLException {
            return MetricSample.builder()
                    .kind(ResourceKind.valueOf(rs.getString("kind")))
                    .namespace(rs.getString("namespace"))
                    .name(rs.getString("name"))
                    .cpuMillicores(rs.getObject("cpu_millicores", Long.class))
                    .memoryBytes(rs.getObject("memory_bytes", Long.class))
                    .diskPercent(rs.getObject("disk_percent", Double.class))
                    .capturedAt(JdbcSupport.instant(rs, "created_at"))
                    .build();
        }
    }
}
