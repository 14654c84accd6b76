package com.company.podwatch.repository;

import com.company.podwatch.domain.DeliveryOutcome;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.domain.enums.DeliveryStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class DeliveryOutcomeRepository {

    private final JdbcTemplate jdbcTemplate;

    public DeliveryOutcome save(DeliveryOutcome outcome) {
        if (outcome.getAttemptedAt() == null) {
            outcome.setAttemptedAt(Instant.now());
        }

        String sql = """
            INSERT INTO delivery_outcomes (alert_id, destination_id, channel_type, status, attempt, error, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, outcome.getAlertId());
            ps.setString(2, outcome.getDestinationId());
            ps.setString(3, outcome.getChannelType().name());
            ps.setString(4, outcome.getStatus().name());
            ps.setInt(5, outcome.getAttempt());
            ps.setString(6, outcome.getError());
            ps.setTimestamp(7, Timestamp.from(outcome.getAttemptedAt()));
            return ps;
        }, keyHolder);

        outcome.setOutcomeId(JdbcSupport.generatedId(keyHolder, "outcome_id"));
        return outcome;
    }

    public List<DeliveryOutcome> findByAlertIds(Collection<Long> alertIds) {
        if (alertIds.isEmpty()) {
            return List.of();
        }
        String sql = """
            SELECT outcome_id, alert_id, destination_id, channel_type, status, attempt, error, created_at
            FROM delivery_outcomes
            WHERE alert_id IN (:alertIds)
            ORDER BY alert_id, created_at, outcome_id
            """;
        return new NamedParameterJdbcTemplate(jdbcTemplate).query(sql,
                new MapSqlParameterSource("alertIds", alertIds), new DeliveryOutcomeRowMapper());
    }

    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM delivery_outcomes WHERE created_at < ?", Timestamp.from(cutoff));
    }

    private static class DeliveryOutcomeRowMapper implements RowMapper<DeliveryOutcome> {
        @Override
        public DeliveryOutcome mapRow(ResultSet rs, int rowNum) throws SQLException {
            return DeliveryOutcome.builder()
                    .outcomeId(rs.getLong("outcome_id"))
                    .alertId(rs.getLong("alert_id"))
                    .destinationId(rs.getString("destination_id"))
                    .channelType(ChannelType.valueOf(rs.getString("channel_type")))
                    .status(DeliveryStatus.fromString(rs.getString("status")))
                    .attempt(rs.getInt("attempt"))
                    .error(rs.getString("error"))
                    .attemptedAt(JdbcSupport.instant(rs, "created_at"))
                    .build();
        }
    }
}
