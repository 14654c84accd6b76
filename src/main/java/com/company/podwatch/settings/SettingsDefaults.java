package com.company.podwatch.settings;

import com.company.podwatch.domain.enums.AlertLevel;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Built-in defaults and the explicit merge of a (possibly partial) stored configuration with them
 */
public final class SettingsDefaults {

    public static final int REFRESH_INTERVAL_SECONDS = 600;
    public static final int RETENTION_DAYS = 30;
    public static final List<String> NAMESPACES = List.of("default", "monitoring");
    public static final String ALL_DAY_START = "00:00";
    public static final String ALL_DAY_END = "23:59";

    private SettingsDefaults() {
    }

    public static PodWatchSettings defaults(String adminPasswordHash) {
        return PodWatchSettings.builder()
                .version(PodWatchSettings.CURRENT_VERSION)
                .monitoring(defaultMonitoring(adminPasswordHash))
                .alertingSchedule(AlertingSchedule.builder()
                        .windows(new ArrayList<>(List.of(allDayWindow())))
                        .build())
                .destinations(defaultDestinations())
                .build();
    }

    /**
     * Returns a complete copy of {@code loaded}: every absent section, list or field is taken from
     * the defaults. Present values are kept even when invalid; validation is a separate step.
     */
    public static PodWatchSettings mergeWithDefaults(PodWatchSettings loaded, String adminPasswordHash) {
        PodWatchSettings defaults = defaults(adminPasswordHash);
        if (loaded == null) {
            return defaults;
        }
        PodWatchSettings merged = SettingsCodec.copy(loaded);
        merged.setVersion(PodWatchSettings.CURRENT_VERSION);

        if (merged.getMonitoring() == null) {
            merged.setMonitoring(defaults.getMonitoring());
        } else {
            mergeMonitoring(merged.getMonitoring(), defaults.getMonitoring());
        }

        if (merged.getAlertingSchedule() == null || merged.getAlertingSchedule().getWindows() == null) {
            merged.setAlertingSchedule(defaults.getAlertingSchedule());
        } else {
            merged.getAlertingSchedule().getWindows().forEach(SettingsDefaults::mergeWindow);
        }

        if (merged.getDestinations() == null) {
            merged.setDestinations(defaults.getDestinations());
        } else {
            mergeDestinations(merged.getDestinations(), defaults.getDestinations());
        }
        return merged;
    }

    private static MonitoringSettings defaultMonitoring(String adminPasswordHash) {
        return MonitoringSettings.builder()
                .refreshIntervalSeconds(REFRESH_INTERVAL_SECONDS)
                .retentionDays(RETENTION_DAYS)
                .namespaces(new ArrayList<>(NAMESPACES))
                .monitorNodes(true)
                .alertOnStatusChange(true)
                .alertOnImageUpdate(true)
                .alertOnNewResource(false)
                .alertOnRemovedResource(false)
                .adminPasswordHash(adminPasswordHash)
                .build();
    }

    private static AlertWindow allDayWindow() {
        return AlertWindow.builder()
                .start(LocalTime.parse(ALL_DAY_START))
                .end(LocalTime.parse(ALL_DAY_END))
                .levels(new ArrayList<>(List.of(AlertLevel.values())))
                .namespaces(new ArrayList<>())
                .build();
    }

    private static DestinationSettings defaultDestinations() {
        return DestinationSettings.builder()
                .email(EmailTransport.builder()
                        .smtpHost("localhost")
                        .smtpPort(25)
                        .username("")
                        .password("")
                        .from("podwatch@localhost")
                        .startTls(false)
                        .build())
                .chatApi(new HttpChannelTransport("", "", ""))
                .sms(new HttpChannelTransport("", "", ""))
                .bot(new HttpChannelTransport("", "", ""))
                .targets(new ArrayList<>())
                .build();
    }

    private static void mergeMonitoring(MonitoringSettings target, MonitoringSettings defaults) {
        if (target.getRefreshIntervalSeconds() == null) target.setRefreshIntervalSeconds(defaults.getRefreshIntervalSeconds());
        if (target.getRetentionDays() == null) target.setRetentionDays(defaults.getRetentionDays());
        if (target.getNamespaces() == null) target.setNamespaces(defaults.getNamespaces());
        if (target.getMonitorNodes() == null) target.setMonitorNodes(defaults.getMonitorNodes());
        if (target.getAlertOnStatusChange() == null) target.setAlertOnStatusChange(defaults.getAlertOnStatusChange());
        if (target.getAlertOnImageUpdate() == null) target.setAlertOnImageUpdate(defaults.getAlertOnImageUpdate());
        if (target.getAlertOnNewResource() == null) target.setAlertOnNewResource(defaults.getAlertOnNewResource());
        if (target.getAlertOnRemovedResource() == null) target.setAlertOnRemovedResource(defaults.getAlertOnRemovedResource());
        if (target.getAdminPasswordHash() == null || target.getAdminPasswordHash().isBlank()) {
            target.setAdminPasswordHash(defaults.getAdminPasswordHash());
        }
    }

    private static void mergeWindow(AlertWindow window) {
        if (window.getLevels() == null) window.setLevels(new ArrayList<>(List.of(AlertLevel.values())));
        if (window.getNamespaces() == null) window.setNamespaces(new ArrayList<>());
    }

    private static void mergeDestinations(DestinationSettings target, DestinationSettings defaults) {
        if (target.getEmail() == null) {
            target.setEmail(defaults.getEmail());
        } else {
            EmailTransport email = target.getEmail();
            EmailTransport fallback = defaults.getEmail();
            if (email.getSmtpHost() == null) email.setSmtpHost(fallback.getSmtpHost());
            if (email.getSmtpPort() == null) email.setSmtpPort(fallback.getSmtpPort());
            if (email.getUsername() == null) email.setUsername(fallback.getUsername());
            if (email.getPassword() == null) email.setPassword(fallback.getPassword());
            if (email.getFrom() == null) email.setFrom(fallback.getFrom());
            if (email.getStartTls() == null) email.setStartTls(fallback.getStartTls());
        }
        if (target.getChatApi() == null) target.setChatApi(defaults.getChatApi());
        if (target.getSms() == null) target.setSms(defaults.getSms());
        if (target.getBot() == null) target.setBot(defaults.getBot());
        if (target.getTargets() == null) target.setTargets(defaults.getTargets());
    }
}
