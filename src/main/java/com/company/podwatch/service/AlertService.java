package com.company.podwatch.service;

import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.DeliveryOutcome;
import com.company.podwatch.domain.enums.AlertDecision;
import com.company.podwatch.domain.enums.AlertLevel;
import com.company.podwatch.domain.enums.ResourceKind;
import com.company.podwatch.exception.HistoryWriteException;
import com.company.podwatch.exception.ResourceNotFoundException;
import com.company.podwatch.settings.PodWatchSettings;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns change events and system notices into alert records, and hands the ones the schedule allows to
 * the dispatcher. An alert is always recorded before any delivery is attempted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertService {

    private final AlertPolicyService policyService;
    private final AlertSeverityClassifier severityClassifier;
    private final AlertDispatchService dispatchService;
    private final HistoryStore historyStore;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    /**
     * Applies the policy to every event and records an alert for each non-skipped one. Each alert is
     * written independently; an alert that cannot be recorded is reported in the result and left out.
     *
     * @return the recorded alerts, in event order; {@link AlertRecord#isDispatched()} tells which may be sent
     */
    public AlertEvaluation evaluate(List<ChangeEvent> events, PodWatchSettings settings) {
        LocalTime now = LocalTime.now(clock);
        List<AlertRecord> recorded = new ArrayList<>();
        BatchWriteResult writes = new BatchWriteResult();

        for (ChangeEvent event : events) {
            AlertDecision decision = policyService.evaluate(event, settings, now);
            meterRegistry.counter("podwatch.alerts.decisions", "decision", decision.name()).increment();
            if (!decision.isRecorded()) {
                continue;
            }
            AlertRecord alert = AlertRecord.builder()
                    .subject(subject(event))
                    .message(message(event))
                    .level(severityClassifier.classify(event))
                    .namespace(event.getNamespace())
                    .name(event.getName())
                    .changeType(event.getChangeType())
                    .dispatched(decision == AlertDecision.DISPATCH)
                    .createdAt(event.getOccurredAt())
                    .build();
            try {
                recorded.add(historyStore.recordAlert(alert));
                writes.recordSuccess();
            } catch (HistoryWriteException e) {
                log.error("Alert '{}' not recorded: {}", alert.getSubject(), e.getMessage(), e);
                writes.recordFailure(alert.getSubject() + ": " + e.getMessage());
                continue;
            }
            if (decision == AlertDecision.RECORD_ONLY) {
                log.info("Alert '{}' recorded, outside alerting windows", alert.getSubject());
            }
        }
        return new AlertEvaluation(recorded, writes);
    }

    /**
     * Sends every alert marked as dispatched to the configured destinations
     */
    public int dispatch(List<AlertRecord> alerts, PodWatchSettings settings) {
        int sent = 0;
        List<AlertDestination> targets = settings.getDestinations().getTargets();
        for (AlertRecord alert : alerts) {
            if (!alert.isDispatched()) {
                continue;
            }
            List<DeliveryOutcome> outcomes = dispatchService.dispatch(alert, targets, settings.getDestinations());
            sent += (int) outcomes.stream().filter(DeliveryOutcome::isSent).count();
        }
        return sent;
    }

    /**
     * Records and, if the schedule allows, sends an alert that is not tied to a resource
     */
    public AlertRecord raiseSystemAlert(String subject, String message, AlertLevel level, PodWatchSettings settings) {
        boolean allowed = policyService.shouldFire(level, null, settings, LocalTime.now(clock));
        AlertRecord alert = historyStore.recordAlert(AlertRecord.builder()
                .subject(subject)
                .message(message)
                .level(level)
                .dispatched(allowed)
                .createdAt(Instant.now(clock))
                .build());
        if (allowed) {
            dispatchService.dispatch(alert, settings.getDestinations().getTargets(), settings.getDestinations());
        } else {
            log.info("System alert '{}' recorded, outside alerting windows", subject);
        }
        return alert;
    }

    /**
     * Sends a test message to one destination, bypassing the schedule and the destination's enabled flag
     */
    public AlertRecord sendTestNotification(String destinationId, PodWatchSettings settings) {
        AlertDestination target = settings.getDestinations().findTarget(destinationId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert destination", destinationId));
        AlertDestination enabledCopy = target.toBuilder().enabled(true).build();

        AlertRecord alert = historyStore.recordAlert(AlertRecord.builder()
                .subject("Test notification")
                .message("Test notification for destination '" + destinationId + "' ("
                        + target.getChannelType().getCode() + ")")
                .level(AlertLevel.INFO)
                .dispatched(true)
                .createdAt(Instant.now(clock))
                .build());
        dispatchService.dispatch(alert, List.of(enabledCopy), settings.getDestinations());
        return alert;
    }

    static String subject(ChangeEvent event) {
        String kind = label(event.getKind());
        return switch (event.getChangeType()) {
            case STATUS_CHANGE -> kind + " Status Change: " + event.getName();
            case IMAGE_CHANGE -> kind + " Image Update: " + event.getName();
            case NEW -> "New " + kind + ": " + event.getName();
            case REMOVED -> kind + " Removed: " + event.getName();
        };
    }

    static String message(ChangeEvent event) {
        String where = label(event.getKind()) + " " + event.getName()
                + (event.getKind().isNamespaced() ? " in namespace " + event.getNamespace() : "");
        return switch (event.getChangeType()) {
            case STATUS_CHANGE -> where + " changed from " + event.getOldValue() + " to " + event.getNewValue();
            case IMAGE_CHANGE -> where + " updated from " + event.getOldValue() + " to " + event.getNewValue();
            case NEW -> where + " appeared with status " + event.getNewValue();
            case REMOVED -> where + " is gone (last status " + event.getOldValue() + ")";
        };
    }

    private static String label(ResourceKind kind) {
        return kind == ResourceKind.NODE ? "Node" : "Pod";
    }
}
