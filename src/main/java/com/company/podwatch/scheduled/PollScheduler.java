package com.company.podwatch.scheduled;

import com.company.podwatch.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Registers the poll cycle with a trigger that is recomputed after every run, so refresh interval
 * changes and backoff take effect without a restart.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "podwatch.poll.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class PollScheduler implements SchedulingConfigurer {

    private final MonitoringCycle monitoringCycle;
    private final BackoffPolicy backoffPolicy;
    private final SettingsService settingsService;
    private final Duration initialDelay;
    private final Clock clock;

    public PollScheduler(MonitoringCycle monitoringCycle,
                         BackoffPolicy backoffPolicy,
                         SettingsService settingsService,
                         @Value("${podwatch.poll.initial-delay:5s}") Duration initialDelay,
                         Clock clock) {
        this.monitoringCycle = monitoringCycle;
        this.backoffPolicy = backoffPolicy;
        this.settingsService = settingsService;
        this.initialDelay = initialDelay;
        this.clock = clock;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addTriggerTask(monitoringCycle::run, this::nextExecution);
        log.info("Poll cycle scheduled, first run in {}", initialDelay);
    }

    Instant nextExecution(TriggerContext context) {
        Instant lastCompletion = context.lastCompletion();
        if (lastCompletion == null) {
            return Instant.now(clock).plus(initialDelay);
        }
        Duration refresh = Duration.ofSeconds(settingsService.current().getMonitoring().getRefreshIntervalSeconds());
        Duration delay = backoffPolicy.nextDelay(refresh);
        if (backoffPolicy.getConsecutiveFailures() > 0) {
            log.info("Next poll in {} (after {} consecutive failures)", delay, backoffPolicy.getConsecutiveFailures());
        }
        return lastCompletion.plus(delay);
    }
}
