package com.company.podwatch.repository;

import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.enums.AlertLevel;
import com.company.podwatch.domain.enums.ChangeType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class AlertRecordRepository {

    private final JdbcTemplate jdbcTemplate;

    public AlertRecord save(AlertRecord alert) {
        if (alert.getCreatedAt() == null) {
            alert.setCreatedAt(Instant.now());
        }

        String sql = """
            INSERT INTO alert_records (subject, message, level, namespace, name, change_type, dispatched, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, alert.getSubject());
            ps.setString(2, alert.getMessage());
            ps.setString(3, alert.getLevel().name());
            ps.setString(4, alert.getNamespace());
            ps.setString(5, alert.getName());
            ps.setString(6, alert.getChangeType() != null ? alert.getChangeType().name() : null);
            ps.setBoolean(7, alert.isDispatched());
            ps.setTimestamp(8, Timestamp.from(alert.getCreatedAt()));
            return ps;
        }, keyHolder);

        alert.setAlertId(JdbcSupport.generatedId(keyHolder, "alert_id"));
        return alert;
    }

    /**
     * Newest first
     */
    public List<AlertRecord> findSince(Instant since) {
        String sql = """
            SELECT alert_id, subject, message, level, namespace, name, change_type, dispatched, created_at
            FROM alert_records
            WHERE created_at >= ?
            ORDER BY created_at DESC, alert_id DESC
            """;
        return jdbcTemplate.query(sql, new AlertRecordRowMapper(), Timestamp.from(since));
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM alert_records WHERE created_at < ?", Timestamp.from(cutoff));
    }

    private static class AlertRecordRowMapper implements RowMapper<AlertRecord> {
        @Override
        public AlertRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AlertRecord.builder()
                    .alertId(rs.getLong("alert_id"))
                    .subject(rs.getString("subject"))
                    .message(rs.getString("message"))
                    .level(AlertLevel.fromString(rs.getString("level")))
                    .namespace(rs.getString("namespace"))
                    .name(rs.getString("name"))
                    .changeType(ChangeType.fromString(rs.getString("change_type")))
                    .dispatched(rs.getBoolean("dispatched"))
                    .createdAt(JdbcSupport.instant(rs, "created_at"))
                    .build();
        }
    }
}
