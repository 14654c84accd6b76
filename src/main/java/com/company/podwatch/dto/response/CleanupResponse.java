package com.company.podwatch.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupResponse {
    private int retentionDays;
    private Map<String, Integer> deleted;
    private int totalDeleted;
}
