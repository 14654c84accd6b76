package com.company.podwatch.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStats implements Serializable {
    private static final long serialVersionUID = 1L;

    private String nodeName;
    private String status; // Ready or NotReady

    private Long cpuAllocatableMillicores;
    private Long memoryAllocatableBytes;
    private Long cpuCapacityMillicores;
    private Long memoryCapacityBytes;

    private Integer podCount;
    private Instant updatedAt;
}
