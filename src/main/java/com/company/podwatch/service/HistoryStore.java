package com.company.podwatch.service;

import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.ChangeQuery;
import com.company.podwatch.domain.DeliveryOutcome;
import com.company.podwatch.domain.MetricSample;
import com.company.podwatch.domain.NodeStats;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.enums.ResourceKind;
import com.company.podwatch.exception.HistoryWriteException;
import com.company.podwatch.repository.AlertRecordRepository;
import com.company.podwatch.repository.ChangeEventRepository;
import com.company.podwatch.repository.DeliveryOutcomeRepository;
import com.company.podwatch.repository.MetricSampleRepository;
import com.company.podwatch.repository.NodeStatsRepository;
import com.company.podwatch.repository.ResourceStatusRepository;
import com.company.podwatch.repository.StorageStatisticsRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Durable record of what happened: change history, usage samples, current state, alerts and
 * delivery outcomes. Write failures always surface as {@link HistoryWriteException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoryStore {

    private final ChangeEventRepository changeEventRepository;
    private final MetricSampleRepository metricSampleRepository;
    private final ResourceStatusRepository resourceStatusRepository;
    private final NodeStatsRepository nodeStatsRepository;
    private final AlertRecordRepository alertRecordRepository;
    private final DeliveryOutcomeRepository deliveryOutcomeRepository;
    private final StorageStatisticsRepository storageStatisticsRepository;
    private final MeterRegistry meterRegistry;

    // ============================================================
    // Writes
    // ============================================================

    /**
     * Writes every event independently.
     *
     * @throws HistoryWriteException if at least one event could not be written; the others are kept
     */
    public BatchWriteResult recordChanges(List<ChangeEvent> events) {
        BatchWriteResult result = new BatchWriteResult();
        for (ChangeEvent event : events) {
            try {
                changeEventRepository.save(event);
                result.recordSuccess();
            } catch (Exception e) {
                log.error("Failed to record {} for {}", event.getChangeType(), event.key(), e);
                result.recordFailure(event.getChangeType() + " " + event.key() + ": " + e.getMessage());
                writeFailure("change_events");
            }
        }
        meterRegistry.counter("podwatch.history.changes.written").increment(result.getWritten());

        if (result.hasFailures()) {
            throw new HistoryWriteException(result.getFailed() + " of " + events.size()
                    + " change events could not be written: " + result.getFailures());
        }
        return result;
    }

    public void recordMetrics(List<MetricSample> samples) {
        if (samples.isEmpty()) {
            return;
        }
        try {
            metricSampleRepository.saveAll(samples);
        } catch (Exception e) {
            writeFailure("metric_samples");
            throw new HistoryWriteException("Failed to record " + samples.size() + " metric samples", e);
        }
    }

    public AlertRecord recordAlert(AlertRecord alert) {
        try {
            return alertRecordRepository.save(alert);
        } catch (Exception e) {
            writeFailure("alert_records");
            throw new HistoryWriteException("Failed to record alert '" + alert.getSubject() + "'", e);
        }
    }

    public DeliveryOutcome recordDelivery(DeliveryOutcome outcome) {
        try {
            return deliveryOutcomeRepository.save(outcome);
        } catch (Exception e) {
            writeFailure("delivery_outcomes");
            throw new HistoryWriteException("Failed to record delivery outcome for alert "
                    + outcome.getAlertId() + " to " + outcome.getDestinationId(), e);
        }
    }

    /**
     * Upserts one current-state row per snapshot and drops the rows of removed resources
     */
    public void saveCurrentState(Collection<ResourceSnapshot> snapshots, Collection<ResourceKey> removedKeys) {
        try {
            snapshots.forEach(resourceStatusRepository::upsert);
            for (ResourceKey key : removedKeys) {
                resourceStatusRepository.delete(key);
                if (key.getKind() == ResourceKind.NODE) {
                    nodeStatsRepository.deleteByName(key.getName());
                }
            }
        } catch (Exception e) {
            writeFailure("resource_status");
            throw new HistoryWriteException("Failed to save current resource state", e);
        }
    }

    /**
     * Replaces the stored ports of every pod in {@code snapshots}
     */
    public void savePorts(Collection<ResourceSnapshot> snapshots) {
        try {
            for (ResourceSnapshot snapshot : snapshots) {
                if (snapshot.isPod()) {
                    resourceStatusRepository.replacePorts(snapshot.getKey(), snapshot.getPorts(), snapshot.getObservedAt());
                }
            }
        } catch (Exception e) {
            writeFailure("resource_ports");
            throw new HistoryWriteException("Failed to save resource ports", e);
        }
    }

    public void saveNodeStats(List<NodeStats> stats) {
        try {
            stats.forEach(nodeStatsRepository::upsert);
        } catch (Exception e) {
            writeFailure("node_stats");
            throw new HistoryWriteException("Failed to save node statistics", e);
        }
    }

    // ============================================================
    // Reads
    // ============================================================

    public List<ChangeEvent> queryChanges(ChangeQuery query) {
        return changeEventRepository.find(query);
    }

    /**
     * Samples of one resource within the trailing {@code window}, oldest first
     */
    public List<MetricSample> queryMetrics(ResourceKey key, Duration window, Instant now) {
        return metricSampleRepository.findByKeySince(key, now.minus(window));
    }

    /**
     * Alert records created at or after {@code since}, newest first, each with its delivery outcomes
     */
    public List<AlertRecord> queryAlerts(Instant since) {
        List<AlertRecord> alerts = alertRecordRepository.findSince(since);
        if (alerts.isEmpty()) {
            return alerts;
        }
        Map<Long, AlertRecord> byId = alerts.stream()
                .collect(Collectors.toMap(AlertRecord::getAlertId, Function.identity()));
        for (DeliveryOutcome outcome : deliveryOutcomeRepository.findByAlertIds(byId.keySet())) {
            AlertRecord alert = byId.get(outcome.getAlertId());
            if (alert != null) {
                alert.getDeliveries().add(outcome);
            }
        }
        return alerts;
    }

    public List<ResourceSnapshot> loadCurrentState() {
        return resourceStatusRepository.findAll();
    }

    public List<NodeStats> loadNodeStats() {
        return nodeStatsRepository.findAll();
    }

    public Set<ResourceKey> findKeysWithImageChangesSince(Instant since) {
        return changeEventRepository.findKeysWithImageChangesSince(since);
    }

    public Map<String, Long> tableStatistics() {
        return storageStatisticsRepository.rowCounts();
    }

    // ============================================================
    // Retention
    // ============================================================

    /**
     * Deletes history older than {@code cutoff} and reclaims storage. Safe to repeat.
     *
     * @return deleted row count per table
     */
    public Map<String, Integer> prune(Instant cutoff) {
        Map<String, Integer> deleted = new LinkedHashMap<>();
        try {
            deleted.put(ChangeEventRepository.STATUS_TABLE, changeEventRepository.deleteStatusHistoryOlderThan(cutoff));
            deleted.put(ChangeEventRepository.IMAGE_TABLE, changeEventRepository.deleteImageHistoryOlderThan(cutoff));
            deleted.put("metric_samples", metricSampleRepository.deleteOlderThan(cutoff));
            // outcomes reference alerts, remove them first
            deleted.put("delivery_outcomes", deliveryOutcomeRepository.deleteOlderThan(cutoff));
            deleted.put("alert_records", alertRecordRepository.deleteOlderThan(cutoff));
        } catch (Exception e) {
            writeFailure("prune");
            throw new HistoryWriteException("Pruning history older than " + cutoff + " failed after " + deleted, e);
        }

        deleted.forEach((table, count) ->
                meterRegistry.counter("podwatch.history.pruned.rows", "table", table).increment(count));
        log.info("Pruned history older than {}: {}", cutoff, deleted);

        if (!storageStatisticsRepository.reclaim()) {
            meterRegistry.counter("podwatch.history.reclaim.failures").increment();
        }
        return deleted;
    }

    private void writeFailure(String table) {
        meterRegistry.counter("podwatch.history.write.failures", "table", table).increment();
    }
}
