package com.company.podwatch.settings;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A null field is "not configured" and is filled from defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringSettings {
    private Integer refreshIntervalSeconds;
    private Integer retentionDays;
    private List<String> namespaces;
    private Boolean monitorNodes;

    private Boolean alertOnStatusChange;
    private Boolean alertOnImageUpdate;
    private Boolean alertOnNewResource;
    private Boolean alertOnRemovedResource;

    private String adminPasswordHash;
}
