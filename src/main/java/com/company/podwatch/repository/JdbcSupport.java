package com.company.podwatch.repository;

import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

final class JdbcSupport {

    private JdbcSupport() {
    }

    static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    /**
     * Drivers differ in what RETURN_GENERATED_KEYS hands back (H2: the identity column, PostgreSQL: the whole
     * row, with different name casing), so the id column is looked up by name.
     */
    static Long generatedId(KeyHolder keyHolder, String column) {
        List<Map<String, Object>> keyList = keyHolder.getKeyList();
        if (keyList.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, Object> entry : keyList.get(0).entrySet()) {
            if (entry.getKey().equalsIgnoreCase(column) && entry.getValue() instanceof Number number) {
                return number.longValue();
            }
        }
        return null;
    }
}
