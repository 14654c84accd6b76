package com.company.podwatch.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageInfoResponse {
    private Map<String, Long> rowCounts;
    private long totalRows;
    private int retentionDays;
    private int trackedResources;
    private Instant lastBaselineAt;
}
