package com.company.podwatch.repository;

import com.company.podwatch.domain.PortInfo;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.ResourceUsage;
import com.company.podwatch.domain.enums.ResourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Current state of every observed resource and its container ports
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ResourceStatusRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Update-then-insert on the (kind, namespace, name) unique key
     */
    public void upsert(ResourceSnapshot snapshot) {
        if (update(snapshot) > 0) {
            return;
        }
        try {
            insert(snapshot);
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent insert for {}, retrying as update", snapshot.getKey());
            update(snapshot);
        }
    }

    private int update(ResourceSnapshot s) {
        String sql = """
            UPDATE resource_status
            SET status = ?, host_assignment = ?, primary_image = ?, ip_internal = ?, ip_external = ?,
                cpu_millicores = ?, memory_bytes = ?, disk_percent = ?, created_at = ?, observed_at = ?
            WHERE kind = ? AND namespace = ? AND name = ?
            """;
        ResourceUsage usage = s.getUsage();
        return jdbcTemplate.update(sql,
                s.getStatus(), s.getHostAssignment(), s.getPrimaryImage(), s.getIpInternal(), s.getIpExternal(),
                usage.getCpuMillicores(), usage.getMemoryBytes(), usage.getDiskPercent(),
                JdbcSupport.timestamp(s.getCreatedAt()), JdbcSupport.timestamp(observedAt(s)),
                s.getKind().name(), s.getKey().getNamespace(), s.getName());
    }

    private void insert(ResourceSnapshot s) {
        String sql = """
            INSERT INTO resource_status (
                kind, namespace, name, status, host_assignment, primary_image, ip_internal, ip_external,
                cpu_millicores, memory_bytes, disk_percent, created_at, observed_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        ResourceUsage usage = s.getUsage();
        jdbcTemplate.update(sql,
                s.getKind().name(), s.getKey().getNamespace(), s.getName(),
                s.getStatus(), s.getHostAssignment(), s.getPrimaryImage(), s.getIpInternal(), s.getIpExternal(),
                usage.getCpuMillicores(), usage.getMemoryBytes(), usage.getDiskPercent(),
                JdbcSupport.timestamp(s.getCreatedAt()), JdbcSupport.timestamp(observedAt(s)));
    }

    /**
     * Replaces the stored ports of one resource
     */
    public void replacePorts(ResourceKey key, List<PortInfo> ports, Instant updatedAt) {
        jdbcTemplate.update("DELETE FROM resource_ports WHERE kind = ? AND namespace = ? AND name = ?",
                key.getKind().name(), key.getNamespace(), key.getName());
        if (ports == null || ports.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO resource_ports (
                kind, namespace, name, port, protocol, port_name, exposed, service_name, service_port,
                load_balancer, external_ip, access_url, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        List<Object[]> batch = new ArrayList<>();
        for (PortInfo p : ports) {
            batch.add(new Object[]{
                    key.getKind().name(), key.getNamespace(), key.getName(), p.getPort(), p.getProtocol(), p.getName(),
                    p.isExposed(), p.getServiceName(), p.getServicePort(), p.isLoadBalancer(),
                    p.getExternalIp(), p.getAccessUrl(), JdbcSupport.timestamp(updatedAt)
            });
        }
        jdbcTemplate.batchUpdate(sql, batch);
    }

    public int delete(ResourceKey key) {
        jdbcTemplate.update("DELETE FROM resource_ports WHERE kind = ? AND namespace = ? AND name = ?",
                key.getKind().name(), key.getNamespace(), key.getName());
        return jdbcTemplate.update("DELETE FROM resource_status WHERE kind = ? AND namespace = ? AND name = ?",
                key.getKind().name(), key.getNamespace(), key.getName());
    }

    /**
     * All current rows with their ports, used to restore the baseline after a restart
     */
    public List<ResourceSnapshot> findAll() {
        String sql = """
            SELECT kind, namespace, name, status, host_assignment, primary_image, ip_internal, ip_external,
                   cpu_millicores, memory_bytes, disk_percent, created_at, observed_at
            FROM resource_status
            ORDER BY kind, namespace, name
            """;
        List<ResourceSnapshot> rows = jdbcTemplate.query(sql, new ResourceSnapshotRowMapper());
        return attachPorts(rows, findAllPorts());
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM resource_status", Long.class);
        return count != null ? count : 0L;
    }

    private Map<ResourceKey, List<PortInfo>> findAllPorts() {
        String sql = """
            SELECT kind, namespace, name, port, protocol, port_name, exposed, service_name, service_port,
                   load_balancer, external_ip, access_url
            FROM resource_ports
            ORDER BY kind, namespace, name, port
            """;
        Map<ResourceKey, List<PortInfo>> ports = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            ResourceKey key = new ResourceKey(
                    ResourceKind.valueOf(rs.getString("kind")), rs.getString("namespace"), rs.getString("name"));
            PortInfo port = PortInfo.builder()
                    .port(rs.getInt("port"))
                    .protocol(rs.getString("protocol"))
                    .name(rs.getString("port_name"))
                    .exposed(rs.getBoolean("exposed"))
                    .serviceName(rs.getString("service_name"))
                    .servicePort(rs.getObject("service_port", Integer.class))
                    .loadBalancer(rs.getBoolean("load_balancer"))
                    .externalIp(rs.getString("external_ip"))
                    .accessUrl(rs.getString("access_url"))
                    .build();
            ports.computeIfAbsent(key, k -> new ArrayList<>()).add(port);
        });
        return ports;
    }

    private List<ResourceSnapshot> attachPorts(List<ResourceSnapshot> rows, Map<ResourceKey, List<PortInfo>> ports) {
        List<ResourceSnapshot> result = new ArrayList<>(rows.size());
        for (ResourceSnapshot row : rows) {
            List<PortInfo> rowPorts = ports.get(row.getKey());
            result.add(rowPorts == null ? row : row.toBuilder().clearPorts().ports(rowPorts).build());
        }
        return result;
    }

    private static Instant observedAt(ResourceSnapshot s) {
        return s.getObservedAt() != null ? s.getObservedAt() : Instant.now();
    }

    private static class ResourceSnapshotRowMapper implements RowMapper<ResourceSnapshot> {
        @Override
        public ResourceSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ResourceSnapshot.builder()
                    .kind(ResourceKind.valueOf(rs.getString("kind")))
                    .namespace(rs.getString("namespace"))
                    .name(rs.getString("name"))
                    .status(rs.getString("status"))
                    .hostAssignment(rs.getString("host_assignment"))
                    .primaryImage(rs.getString("primary_image"))
                    .ipInternal(rs.getString("ip_internal"))
                    .ipExternal(rs.getString("ip_external"))
                    .usage(ResourceUsage.builder()
                            .cpuMillicores(rs.getObject("cpu_millicores", Long.class))
                            .memoryBytes(rs.getObject("memory_bytes", Long.class))
                            .diskPercent(rs.getObject("disk_percent", Double.class))
                            .build())
                    .createdAt(JdbcSupport.instant(rs, "created_at"))
                    .observedAt(JdbcSupport.instant(rs, "observed_at"))
                    .build();
        }
    }
}
