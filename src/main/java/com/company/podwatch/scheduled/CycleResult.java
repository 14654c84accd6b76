package com.company.podwatch.scheduled;

import com.company.podwatch.domain.enums.CycleState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Summary of one poll cycle
 */
@Value
@Builder
public class CycleResult {
    boolean success;
    // state in which the cycle failed, null on success
    CycleState failedIn;
    String error;
    int resourceCount;
    int changeCount;
    int alertsRecorded;
    int deliveriesSent;
    int nonFatalFailures;
    Instant startedAt;
    Instant finishedAt;

    public static CycleResult skipped(Instant now) {
        return CycleResult.builder()
                .success(false)
                .error("A poll cycle is already running")
                .startedAt(now)
                .finishedAt(now)
                .build();
    }
}
