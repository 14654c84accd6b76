package com.company.podwatch.dto.response;

import com.company.podwatch.scheduled.CycleResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleRunResponse {
    private boolean success;
    private String failedIn;
    private String error;
    private int resourceCount;
    private int changeCount;
    private int alertsRecorded;
    private int deliveriesSent;
    private Instant startedAt;
    private Instant finishedAt;

    public static CycleRunResponse from(CycleResult result) {
        return CycleRunResponse.builder()
                .success(result.isSuccess())
                .failedIn(result.getFailedIn() != null ? result.getFailedIn().name() : null)
                .error(result.getError())
                .resourceCount(result.getResourceCount())
                .changeCount(result.getChangeCount())
                .alertsRecorded(result.getAlertsRecorded())
                .deliveriesSent(result.getDeliveriesSent())
                .startedAt(result.getStartedAt())
                .finishedAt(result.getFinishedAt())
                .build();
    }
}
