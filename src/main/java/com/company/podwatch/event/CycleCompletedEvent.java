package com.company.podwatch.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class CycleCompletedEvent {
    private final Instant completedAt;
    private final int changeCount;
    private final int resourceCount;
}
