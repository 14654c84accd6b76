package com.company.podwatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUsage implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final ResourceUsage EMPTY = new ResourceUsage();

    private Long cpuMillicores;
    private Long memoryBytes;
    private Double diskPercent;

    /**
     * True when at least one measurement was obtained
     */
    @JsonIgnore
    public boolean isObtained() {
        return cpuMillicores != null || memoryBytes != null || diskPercent != null;
    }
}
