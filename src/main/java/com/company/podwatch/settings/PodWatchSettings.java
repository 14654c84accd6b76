package com.company.podwatch.settings;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Process-wide runtime configuration, persisted as JSON in the config table.
 * Sections are never absent once loaded: see {@link SettingsDefaults#mergeWithDefaults}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PodWatchSettings {

    public static final int CURRENT_VERSION = 1;

    private Integer version;
    private MonitoringSettings monitoring;
    private AlertingSchedule alertingSchedule;
    private DestinationSettings destinations;
}
