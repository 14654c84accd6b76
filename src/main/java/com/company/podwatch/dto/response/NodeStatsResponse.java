package com.company.podwatch.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStatsResponse {
    private String name;
    private String status;
    private Integer pods;

    private Long cpuAllocatableMillicores;
    private Long memoryAllocatableBytes;
    private Long cpuCapacityMillicores;
    private Long memoryCapacityBytes;

    private String cpu;
    private String memory;
    private String cpuCapacity;
    private String memoryCapacity;

    private Instant updatedAt;
}
