package com.company.podwatch.event;

import com.company.podwatch.settings.PodWatchSettings;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SettingsUpdatedEvent {
    private final PodWatchSettings settings;
}
