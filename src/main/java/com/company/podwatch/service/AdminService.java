package com.company.podwatch.service;

import com.company.podwatch.cache.SnapshotStore;
import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.dto.response.CleanupResponse;
import com.company.podwatch.dto.response.CycleRunResponse;
import com.company.podwatch.dto.response.StorageInfoResponse;
import com.company.podwatch.exception.AdminOperationException;
import com.company.podwatch.exception.InvalidCredentialException;
import com.company.podwatch.exception.InventoryException;
import com.company.podwatch.exception.ResourceNotFoundException;
import com.company.podwatch.inventory.InventoryClient;
import com.company.podwatch.scheduled.CycleResult;
import com.company.podwatch.scheduled.MonitoringCycle;
import com.company.podwatch.security.OperatorContext;
import com.company.podwatch.settings.PodWatchSettings;
import com.company.podwatch.settings.SettingsMasking;
import com.company.podwatch.settings.SettingsService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Operator actions. Every mutation checks the admin credential before touching anything.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdminService {

    private final SettingsService settingsService;
    private final InventoryClient inventoryClient;
    private final RetentionService retentionService;
    private final MonitoringCycle monitoringCycle;
    private final AlertService alertService;
    private final HistoryStore historyStore;
    private final SnapshotStore snapshotStore;
    private final OperatorContext operatorContext;
    private final MeterRegistry meterRegistry;

    public PodWatchSettings getConfig() {
        return settingsService.currentMasked();
    }

    public PodWatchSettings updateConfig(PodWatchSettings settings, String newAdminPassword, String credential) {
        requireCredential("updateConfig", credential);

        PodWatchSettings updated = settingsService.update(settings, newAdminPassword);
        audit("updateConfig", newAdminPassword != null ? "settings and admin password" : "settings");
        return SettingsMasking.mask(updated);
    }

    /**
     * Deletes the pod so its controller recreates it
     */
    public void triggerManualRestart(ResourceKey key, String credential) {
        requireCredential("restart", credential);

        boolean deleted;
        try {
            deleted = inventoryClient.deleteResource(key);
        } catch (InventoryException e) {
            log.error("Restart of {} failed", key, e);
            meterRegistry.counter("podwatch.admin.operations", "operation", "restart", "outcome", "failed")
                    .increment();
            throw new AdminOperationException("Restart of " + key + " failed: " + e.getMessage(), e);
        }

        if (!deleted) {
            throw new ResourceNotFoundException("Pod", key.getNamespace() + "/" + key.getName());
        }
        audit("restart", key.toString());
    }

    /**
     * @param retentionDays days to keep, or null for the configured retention
     */
    public CleanupResponse runCleanup(Integer retentionDays, String credential) {
        requireCredential("cleanup", credential);

        int days = retentionDays != null
                ? retentionDays
                : settingsService.current().getMonitoring().getRetentionDays();

        Map<String, Integer> deleted = retentionService.prune(days);
        int total = deleted.values().stream().mapToInt(Integer::intValue).sum();
        audit("cleanup", total + " rows older than " + days + " days");

        return CleanupResponse.builder()
                .retentionDays(days)
                .deleted(deleted)
                .totalDeleted(total)
                .build();
    }

    /**
     * Runs a poll cycle now, on the caller's thread
     *
     * @throws AdminOperationException if a cycle is already running
     */
    public CycleRunResponse triggerCycle(String credential) {
        requireCredential("checkNow", credential);

        CycleResult result = monitoringCycle.run();
        if (!result.isSuccess() && result.getFailedIn() == null) {
            throw new AdminOperationException(result.getError());
        }
        audit("checkNow", result.isSuccess() ? "succeeded" : "failed in " + result.getFailedIn());
        return CycleRunResponse.from(result);
    }

    public AlertRecord sendTestNotification(String destinationId, String credential) {
        requireCredential("testNotification", credential);

        AlertRecord alert = alertService.sendTestNotification(destinationId, settingsService.current());
        audit("testNotification", destinationId);
        return alert;
    }

    public StorageInfoResponse storageInfo() {
        Map<String, Long> rowCounts = historyStore.tableStatistics();

        return StorageInfoResponse.builder()
                .rowCounts(rowCounts)
                .totalRows(rowCounts.values().stream().mapToLong(Long::longValue).sum())
                .retentionDays(settingsService.current().getMonitoring().getRetentionDays())
                .trackedResources(snapshotStore.size())
                .lastBaselineAt(snapshotStore.getLastSwapAt().orElse(null))
                .build();
    }

    private void requireCredential(String operation, String credential) {
        if (!settingsService.verifyCredential(credential)) {
            log.warn("Rejected {} by {}: invalid admin credential", operation, operatorContext.describe());
            meterRegistry.counter("podwatch.admin.operations", "operation", operation, "outcome", "rejected")
                    .increment();
            throw new InvalidCredentialException();
        }
    }

    private void audit(String operation, String detail) {
        log.info("Admin {} by {}: {}", operation, operatorContext.describe(), detail);
        meterRegistry.counter("podwatch.admin.operations", "operation", operation, "outcome", "ok").increment();
    }
}
