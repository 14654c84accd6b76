package com.company.podwatch.repository;

import com.company.podwatch.domain.NodeStats;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class NodeStatsRepository {

    private final JdbcTemplate jdbcTemplate;

    public void upsert(NodeStats stats) {
        Instant updatedAt = stats.getUpdatedAt() != null ? stats.getUpdatedAt() : Instant.now();
        String update = """
            UPDATE node_stats
            SET status = ?, cpu_allocatable_millicores = ?, memory_allocatable_bytes = ?,
                cpu_capacity_millicores = ?, memory_capacity_bytes = ?, pod_count = ?, updated_at = ?
            WHERE node_name = ?
            """;
        Object[] updateArgs = {
                stats.getStatus(), stats.getCpuAllocatableMillicores(), stats.getMemoryAllocatableBytes(),
                stats.getCpuCapacityMillicores(), stats.getMemoryCapacityBytes(), stats.getPodCount(),
                JdbcSupport.timestamp(updatedAt), stats.getNodeName()
        };
        if (jdbcTemplate.update(update, updateArgs) > 0) {
            return;
        }
        String insert = """
            INSERT INTO node_stats (
                node_name, status, cpu_allocatable_millicores, memory_allocatable_bytes,
                cpu_capacity_millicores, memory_capacity_bytes, pod_count, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(insert,
                    stats.getNodeName(), stats.getStatus(), stats.getCpuAllocatableMillicores(),
                    stats.getMemoryAllocatableBytes(), stats.getCpuCapacityMillicores(),
                    stats.getMemoryCapacityBytes(), stats.getPodCount(), JdbcSupport.timestamp(updatedAt));
        } catch (DuplicateKeyException e) {
            jdbcTemplate.update(update, updateArgs);
        }
    }

    public List<NodeStats> findAll() {
        String sql = """
            SELECT node_name, status, cpu_allocatable_millicores, memory_allocatable_bytes,
                   cpu_capacity_millicores, memory_capacity_bytes, pod_count, updated_at
            FROM node_stats
            ORDER BY node_name
            """;
        return jdbcTemplate.query(sql, new NodeStatsRowMapper());
    }

    public int deleteByName(String nodeName) {
        return jdbcTemplate.update("DELETE FROM node_stats WHERE node_name = ?", nodeName);
    }

    private static class NodeStatsRowMapper implements RowMapper<NodeStats> {
        @Override
        public NodeStats mapRow(ResultSet rs, int rowNum) throws SQLException {
            return NodeStats.builder()
                    .nodeName(rs.getString("node_name"))
                    .status(rs.getString("status"))
                    .cpuAllocatableMillicores(rs.getObject("cpu_allocatable_millicores", Long.class))
                    .memoryAllocatableBytes(rs.getObject("memory_allocatable_bytes", Long.class))
                    .cpuCapacityMillicores(rs.getObject("cpu_capacity_millicores", Long.class))
                    .memoryCapacityBytes(rs.getObject("memory_capacity_bytes", Long.class))
                    .podCount(rs.getObject("pod_count", Integer.class))
                    .updatedAt(JdbcSupport.instant(rs, "updated_at"))
                    .build();
        }
    }
}
