package com.company.podwatch.settings;

import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.exception.SettingsValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a merged configuration. Expects every section to be present.
 */
public final class SettingsValidator {

    private SettingsValidator() {
    }

    public static List<String> validate(PodWatchSettings settings) {
        List<String> errors = new ArrayList<>();
        if (settings == null) {
            errors.add("settings are missing");
            return errors;
        }

        MonitoringSettings monitoring = settings.getMonitoring();
        if (monitoring == null) {
            errors.add("monitoring section is missing");
        } else {
            if (monitoring.getRefreshIntervalSeconds() == null || monitoring.getRefreshIntervalSeconds() < 10) {
                errors.add("monitoring.refreshIntervalSeconds must be at least 10");
            }
            if (monitoring.getRetentionDays() == null || monitoring.getRetentionDays() < 1) {
                errors.add("monitoring.retentionDays must be at least 1");
            }
            if (monitoring.getNamespaces() == null || monitoring.getNamespaces().isEmpty()) {
                errors.add("monitoring.namespaces must name at least one namespace");
            } else if (monitoring.getNamespaces().stream().anyMatch(ns -> ns == null || ns.isBlank())) {
                errors.add("monitoring.namespaces must not contain blank entries");
            }
            if (monitoring.getAdminPasswordHash() == null || monitoring.getAdminPasswordHash().isBlank()) {
                errors.add("monitoring.adminPasswordHash is missing");
            }
        }

        AlertingSchedule schedule = settings.getAlertingSchedule();
        if (schedule == null || schedule.getWindows() == null) {
            errors.add("alertingSchedule section is missing");
        } else {
            for (int i = 0; i < schedule.getWindows().size(); i++) {
                validateWindow(schedule.getWindows().get(i), i, errors);
            }
        }

        DestinationSettings destinations = settings.getDestinations();
        if (destinations == null || destinations.getTargets() == null) {
            errors.add("destinations section is missing");
        } else {
            validateTargets(destinations.getTargets(), errors);
        }
        return errors;
    }

    public static void requireValid(PodWatchSettings settings) {
        List<String> errors = validate(settings);
        if (!errors.isEmpty()) {
            throw new SettingsValidationException(errors);
        }
    }

    private static void validateWindow(AlertWindow window, int index, List<String> errors) {
        String prefix = "alertingSchedule.windows[" + index + "]";
        if (window == null) {
            errors.add(prefix + " is null");
            return;
        }
        if (window.getStart() == null || window.getEnd() == null) {
            errors.add(prefix + " needs start and end (HH:mm)");
        } else if (window.getStart().isAfter(window.getEnd())) {
            errors.add(prefix + " start must not be after end (windows are same-day)");
        }
        if (window.getLevels() == null || window.getLevels().isEmpty()) {
            errors.add(prefix + ".levels must not be empty");
        }
    }

    private static void validateTargets(List<AlertDestination> targets, List<String> errors) {
        Set<String> ids = new HashSet<>();
        for (AlertDestination target : targets) {
            if (target == null || target.getId() == null || target.getId().isBlank()) {
                errors.add("destinations.targets entries need an id");
                continue;
            }
            if (!ids.add(target.getId())) {
                errors.add("destinations.targets id '" + target.getId() + "' is duplicated");
            }
            if (target.getChannelType() == null) {
                errors.add("destinations.targets '" + target.getId() + "' needs a channelType");
            }
            if (target.getAddress() == null || target.getAddress().isBlank()) {
                errors.add("destinations.targets '" + target.getId() + "' needs an address");
            }
        }
    }
}
