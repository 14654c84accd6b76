package com.company.podwatch.service;

import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.enums.AlertDecision;
import com.company.podwatch.domain.enums.AlertLevel;
import com.company.podwatch.settings.AlertWindow;
import com.company.podwatch.settings.MonitoringSettings;
import com.company.podwatch.settings.PodWatchSettings;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.util.List;

/**
 * Decides whether a change is alertable and, if so, whether any alert window lets it through right now
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertPolicyService {

    private final AlertSeverityClassifier severityClassifier;
    private final MeterRegistry meterRegistry;

    /**
     * Never throws. Evaluation errors are logged and resolve to {@link AlertDecision#DISPATCH}.
     *
     * @param now local wall-clock time in the configured zone
     */
    public AlertDecision evaluate(ChangeEvent event, PodWatchSettings settings, LocalTime now) {
        try {
            if (!isAlertable(event, settings.getMonitoring())) {
                return AlertDecision.SKIP;
            }
            return shouldFire(severityClassifier.classify(event), event.getNamespace(), settings, now)
                    ? AlertDecision.DISPATCH
                    : AlertDecision.RECORD_ONLY;
        } catch (Exception e) {
            log.error("Alert policy evaluation failed for {}, dispatching anyway", event, e);
            meterRegistry.counter("podwatch.alerts.policy.errors").increment();
            return AlertDecision.DISPATCH;
        }
    }

    /**
     * True when at least one window covers {@code now}, allows {@code level} and allows {@code namespace}.
     * Errors resolve to true.
     */
    public boolean shouldFire(AlertLevel level, String namespace, PodWatchSettings settings, LocalTime now) {
        try {
            List<AlertWindow> windows = settings.getAlertingSchedule().getWindows();
            for (AlertWindow window : windows) {
                if (window.covers(now) && window.allowsLevel(level) && window.allowsNamespace(namespace)) {
                    return true;
                }
            }
            return false;
        } catch (Exception e) {
            log.error("Alert window check failed (level={}, namespace={}), allowing alert", level, namespace, e);
            meterRegistry.counter("podwatch.alerts.policy.errors").increment();
            return true;
        }
    }

    private boolean isAlertable(ChangeEvent event, MonitoringSettings monitoring) {
        if (event.isInitialObservation()) {
            return false;
        }
        return switch (event.getChangeType()) {
            case STATUS_CHANGE -> Boolean.TRUE.equals(monitoring.getAlertOnStatusChange());
            case IMAGE_CHANGE -> Boolean.TRUE.equals(monitoring.getAlertOnImageUpdate());
            case NEW -> Boolean.TRUE.equals(monitoring.getAlertOnNewResource());
            case REMOVED -> Boolean.TRUE.equals(monitoring.getAlertOnRemovedResource());
        };
    }
}
