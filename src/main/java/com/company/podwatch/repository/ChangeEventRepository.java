package com.company.podwatch.repository;

import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.ChangeQuery;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.enums.ChangeType;
import com.company.podwatch.domain.enums.ResourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Change history. Image changes are kept in image_history, every other change type in status_history;
 * reads merge both.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ChangeEventRepository {

    public static final String STATUS_TABLE = "status_history";
    public static final String IMAGE_TABLE = "image_history";

    private final JdbcTemplate jdbcTemplate;

    public ChangeEvent save(ChangeEvent event) {
        if (event.getOccurredAt() == null) {
            event.setOccurredAt(Instant.now());
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();

        if (event.getChangeType().isImageHistory()) {
            String sql = """
                INSERT INTO image_history (kind, namespace, name, old_image, new_image, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
                ps.setString(1, event.getKind().name());
                ps.setString(2, event.key().getNamespace());
                ps.setString(3, event.getName());
                ps.setString(4, event.getOldValue());
                ps.setString(5, event.getNewValue());
                ps.setTimestamp(6, Timestamp.from(event.getOccurredAt()));
                return ps;
            }, keyHolder);
        } else {
            String sql = """
                INSERT INTO status_history (
                    kind, namespace, name, change_type, old_value, new_value, initial_observation, created_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
                ps.setString(1, event.getKind().name());
                ps.setString(2, event.key().getNamespace());
                ps.setString(3, event.getName());
                ps.setString(4, event.getChangeType().name());
                ps.setString(5, event.getOldValue());
                ps.setString(6, event.getNewValue());
                ps.setBoolean(7, event.isInitialObservation());
                ps.setTimestamp(8, Timestamp.from(event.getOccurredAt()));
                return ps;
            }, keyHolder);
        }

        event.setId(JdbcSupport.generatedId(keyHolder, "id"));
        return event;
    }

    /**
     * Merged status and image history, newest first
     */
    public List<ChangeEvent> find(ChangeQuery query) {
        StringBuilder sql = new StringBuilder("""
            SELECT id, kind, namespace, name, change_type, old_value, new_value, initial_observation, created_at
            FROM (
                SELECT id, kind, namespace, name, change_type, old_value, new_value, initial_observation, created_at
                FROM status_history
                UNION ALL
                SELECT id, kind, namespace, name, 'IMAGE_CHANGE' AS change_type, old_image AS old_value,
                       new_image AS new_value, FALSE AS initial_observation, created_at
                FROM image_history
            ) changes
            WHERE 1 = 1
            """);
        List<Object> params = new ArrayList<>();

        if (query.getNamespace() != null) {
            sql.append(" AND namespace = ?");
            params.add(query.getNamespace());
        }
        if (query.getName() != null) {
            sql.append(" AND name = ?");
            params.add(query.getName());
        }
        if (query.getChangeType() != null) {
            sql.append(" AND change_type = ?");
            params.add(query.getChangeType().name());
        }
        if (query.getSince() != null) {
            sql.append(" AND created_at >= ?");
            params.add(Timestamp.from(query.getSince()));
        }
        if (query.getUntil() != null) {
            sql.append(" AND created_at <= ?");
            params.add(Timestamp.from(query.getUntil()));
        }
        sql.append(" ORDER BY created_at DESC, id DESC");
        if (query.getLimit() != null) {
            sql.append(" LIMIT ?");
            params.add(query.getLimit());
        }

        return jdbcTemplate.query(sql.toString(), new ChangeEventRowMapper(), params.toArray());
    }

    public Set<ResourceKey> findKeysWithImageChangesSince(Instant since) {
        String sql = """
            SELECT DISTINCT kind, namespace, name
            FROM image_history
            WHERE created_at >= ?
            """;
        Set<ResourceKey> keys = new HashSet<>();
        jdbcTemplate.query(sql, rs -> {
            keys.add(new ResourceKey(
                    ResourceKind.valueOf(rs.getString("kind")), rs.getString("namespace"), rs.getString("name")));
        }, Timestamp.from(since));
        return keys;
    }

    public int deleteStatusHistoryOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM status_history WHERE created_at < ?", Timestamp.from(cutoff));
    }

    public int deleteImageHistoryOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM image_history WHERE created_at < ?", Timestamp.from(cutoff));
    }

    private static class ChangeEventRowMapper implements RowMapper<ChangeEvent> {
        @Override
        public ChangeEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ChangeEvent.builder()
                    .id(rs.getLong("id"))
                    .kind(ResourceKind.valueOf(rs.getString("kind")))
                    .namespace(rs.getString("namespace"))
                    .name(rs.getString("name"))
                    .changeType(ChangeType.fromString(rs.getString("change_type")))
                    .oldValue(rs.getString("old_value"))
                    .newValue(rs.getString("new_value"))
                    .initialObservation(rs.getBoolean("initial_observation"))
                    .occurredAt(JdbcSupport.instant(rs, "created_at"))
                    .build();
        }
    }
}
