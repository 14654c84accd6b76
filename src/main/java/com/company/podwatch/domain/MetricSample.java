package com.company.podwatch.domain;

import com.company.podwatch.domain.enums.ResourceKind;
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
public class MetricSample implements Serializable {
    private static final long serialVersionUID = 1L;

    private ResourceKind kind;
    private String namespace;
    private String name;

    private Long cpuMillicores;
    private Long memoryBytes;
    private Double diskPercent;

    private Instant capturedAt;

    public static MetricSample of(ResourceSnapshot snapshot) {
        ResourceUsage usage = snapshot.getUsage();
        return MetricSample.builder()
                .kind(snapshot.getKind())
                .namespace(snapshot.getNamespace())
                .name(snapshot.getName())
                .cpuMillicores(usage.getCpuMillicores())
                .memoryBytes(usage.getMemoryBytes())
                .diskPercent(usage.getDiskPercent())
                .capturedAt(snapshot.getObservedAt())
                .build();
    }
}
