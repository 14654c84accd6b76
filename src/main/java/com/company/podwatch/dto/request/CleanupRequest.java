package com.company.podwatch.dto.request;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupRequest {
    // Defaults to the configured retention when absent
    @Min(value = 1, message = "Retention must be at least one day")
    private Integer retentionDays;
}
