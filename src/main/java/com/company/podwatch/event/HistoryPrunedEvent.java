package com.company.podwatch.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

@Getter
@AllArgsConstructor
public class HistoryPrunedEvent {
    private final Instant cutoff;
    private final Map<String, Integer> deletedCounts;
}
