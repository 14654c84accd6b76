package com.company.podwatch.config;

import com.company.podwatch.cache.SnapshotStore;
import com.company.podwatch.scheduled.BackoffPolicy;
import com.company.podwatch.scheduled.MonitoringCycle;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final SnapshotStore snapshotStore;
    private final MonitoringCycle monitoringCycle;
    private final BackoffPolicy backoffPolicy;

    @Bean
    public MeterBinder podwatchMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("podwatch.baseline.resources", snapshotStore, SnapshotStore::size)
                    .description("Resources in the last successful baseline")
                    .register(reg);

            Gauge.builder("podwatch.cycle.running", monitoringCycle, cycle -> cycle.isRunning() ? 1 : 0)
                    .description("1 while a poll cycle is in progress")
                    .register(reg);

            Gauge.builder("podwatch.cycle.consecutive.failures", backoffPolicy, BackoffPolicy::getConsecutiveFailures)
                    .description("Poll cycles failed in a row since the last success")
                    .register(reg);

            log.info("PodWatch metrics registered");
        };
    }
}
