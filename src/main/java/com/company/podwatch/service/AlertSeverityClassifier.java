package com.company.podwatch.service;

import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.enums.AlertLevel;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class AlertSeverityClassifier {

    static final Set<String> CRITICAL_STATUSES = Set.of(
            "Failed", "CrashLoopBackOff", "Unknown", "NotReady", "Error", "ImagePullBackOff", "ErrImagePull");

    public AlertLevel classify(ChangeEvent event) {
        return switch (event.getChangeType()) {
            case STATUS_CHANGE -> CRITICAL_STATUSES.contains(event.getNewValue()) ? AlertLevel.CRITICAL : AlertLevel.WARNING;
            case REMOVED -> AlertLevel.WARNING;
            case IMAGE_CHANGE, NEW -> AlertLevel.INFO;
        };
    }
}
