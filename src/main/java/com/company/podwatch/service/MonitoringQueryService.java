package com.company.podwatch.service;

import com.company.podwatch.cache.SnapshotStore;
import com.company.podwatch.config.RedisCacheConfig;
import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.ChangeQuery;
import com.company.podwatch.domain.MetricSample;
import com.company.podwatch.domain.NodeStats;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.ResourceUsage;
import com.company.podwatch.domain.enums.ChangeType;
import com.company.podwatch.dto.response.NodeStatsResponse;
import com.company.podwatch.dto.response.ResourceStatusResponse;
import com.company.podwatch.util.ResourceUnits;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read side for dashboards. Current state comes from the in-memory baseline; history goes
 * through Redis-backed caches that are evicted whenever a cycle, prune or settings update lands.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonitoringQueryService {

    static final int NEW_RESOURCE_DAYS = 7;
    static final int RECENT_IMAGE_UPDATE_DAYS = 7;

    private final SnapshotStore snapshotStore;
    private final HistoryStore historyStore;
    private final Clock clock;

    public List<ResourceStatusResponse> getCurrentSnapshots(String namespace) {
        Instant now = clock.instant();
        List<ResourceSnapshot> snapshots = snapshotStore.findByNamespace(namespace);

        Set<ResourceKey> recentlyUpdated = snapshots.isEmpty()
                ? Set.of()
                : historyStore.findKeysWithImageChangesSince(now.minus(Duration.ofDays(RECENT_IMAGE_UPDATE_DAYS)));

        return snapshots.stream()
                .map(snapshot -> toResponse(snapshot, recentlyUpdated.contains(snapshot.getKey()), now))
                .collect(Collectors.toList());
    }

    @Cacheable(value = RedisCacheConfig.NODE_STATS, key = "'all'")
    public List<NodeStatsResponse> getNodes() {
        log.debug("Cache miss - loading node statistics");

        return historyStore.loadNodeStats().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Cacheable(
            value = RedisCacheConfig.RECENT_CHANGES,
            key = "#sinceDays + '-' + #namespace + '-' + #name + '-' + #changeType + '-' + #limit"
    )
    public List<ChangeEvent> getRecentChanges(int sinceDays, String namespace, String name,
                                              ChangeType changeType, Integer limit) {
        log.debug("Cache miss - fetching changes of the last {} days", sinceDays);

        ChangeQuery query = ChangeQuery.builder()
                .since(clock.instant().minus(Duration.ofDays(sinceDays)))
                .namespace(blankToNull(namespace))
                .name(blankToNull(name))
                .changeType(changeType)
                .limit(limit)
                .build();

        return new ArrayList<>(historyStore.queryChanges(query));
    }

    @Cacheable(value = RedisCacheConfig.METRIC_SAMPLES, key = "#key.toString() + '-' + #hours")
    public List<MetricSample> getMetrics(ResourceKey key, int hours) {
        log.debug("Cache miss - fetching {}h of samples for {}", hours, key);

        return new ArrayList<>(historyStore.queryMetrics(key, Duration.ofHours(hours), clock.instant()));
    }

    @Cacheable(value = RedisCacheConfig.RECENT_ALERTS, key = "#sinceDays")
    public List<AlertRecord> getRecentAlerts(int sinceDays) {
        log.debug("Cache miss - fetching alerts of the last {} days", sinceDays);

        return new ArrayList<>(historyStore.queryAlerts(clock.instant().minus(Duration.ofDays(sinceDays))));
    }

    private ResourceStatusResponse toResponse(ResourceSnapshot snapshot, boolean imageUpdatedRecently, Instant now) {
        ResourceUsage usage = snapshot.getUsage();
        Long ageDays = ResourceUnits.ageDays(snapshot.getCreatedAt(), now);

        return ResourceStatusResponse.builder()
                .kind(snapshot.getKind().name())
                .namespace(snapshot.getNamespace())
                .name(snapshot.getName())
                .status(snapshot.getStatus())
                .node(snapshot.getHostAssignment())
                .image(snapshot.getPrimaryImage())
                .ipInternal(snapshot.getIpInternal())
                .ipExternal(snapshot.getIpExternal())
                .ports(new ArrayList<>(snapshot.getPorts()))
                .cpuMillicores(usage.getCpuMillicores())
                .memoryBytes(usage.getMemoryBytes())
                .diskPercent(usage.getDiskPercent())
                .cpuFormatted(ResourceUnits.formatCpu(usage.getCpuMillicores()))
                .memoryFormatted(ResourceUnits.formatMemory(usage.getMemoryBytes()))
                .diskFormatted(ResourceUnits.formatPercent(usage.getDiskPercent()))
                .createdAt(snapshot.getCreatedAt())
                .observedAt(snapshot.getObservedAt())
                .ageDays(ageDays)
                .isNew(ageDays != null && ageDays < NEW_RESOURCE_DAYS)
                .imageUpdatedRecently(imageUpdatedRecently)
                .build();
    }

    private NodeStatsResponse toResponse(NodeStats stats) {
        return NodeStatsResponse.builder()
                .name(stats.getNodeName())
                .status(stats.getStatus())
                .pods(stats.getPodCount())
                .cpuAllocatableMillicores(stats.getCpuAllocatableMillicores())
                .memoryAllocatableBytes(stats.getMemoryAllocatableBytes())
                .cpuCapacityMillicores(stats.getCpuCapacityMillicores())
                .memoryCapacityBytes(stats.getMemoryCapacityBytes())
                .cpu(ResourceUnits.formatCpu(stats.getCpuAllocatableMillicores()))
                .memory(ResourceUnits.formatMemory(stats.getMemoryAllocatableBytes()))
                .cpuCapacity(ResourceUnits.formatCpu(stats.getCpuCapacityMillicores()))
                .memoryCapacity(ResourceUnits.formatMemory(stats.getMemoryCapacityBytes()))
                .updatedAt(stats.getUpdatedAt())
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
