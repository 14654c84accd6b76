package com.company.podwatch.scheduled;

import com.company.podwatch.domain.enums.AlertLevel;
import com.company.podwatch.service.AlertService;
import com.company.podwatch.service.RetentionService;
import com.company.podwatch.settings.PodWatchSettings;
import com.company.podwatch.settings.SettingsService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Daily history pruning, independent of the poll loop
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "podwatch.retention.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class RetentionJob {

    private final RetentionService retentionService;
    private final SettingsService settingsService;
    private final AlertService alertService;
    private final MeterRegistry meterRegistry;

    /**
     * Prune at midnight with the configured retention, then announce it as a maintenance alert
     */
    @Scheduled(cron = "${podwatch.retention.cron:0 0 0 * * *}", zone = "${podwatch.time-zone:UTC}")
    public void pruneScheduled() {
        PodWatchSettings settings = settingsService.current();
        int retentionDays = settings.getMonitoring().getRetentionDays();
        log.info("Starting scheduled history pruning ({} days retention)", retentionDays);

        try {
            Map<String, Integer> deleted = retentionService.prune(retentionDays);
            int total = deleted.values().stream().mapToInt(Integer::intValue).sum();
            alertService.raiseSystemAlert(
                    "System Maintenance",
                    "Cleaned up " + total + " old records as per " + retentionDays + " days retention policy",
                    AlertLevel.INFO,
                    settings);
            meterRegistry.counter("podwatch.retention.runs", "outcome", "success").increment();
        } catch (Exception e) {
            log.error("Scheduled history pruning failed", e);
            meterRegistry.counter("podwatch.retention.runs", "outcome", "failure").increment();
        }
    }
}
