package com.company.podwatch.dto.response;

import com.company.podwatch.domain.PortInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceStatusResponse {
    private String kind;
    private String namespace;
    private String name;
    private String status;
    private String node;
    private String image;
    private String ipInternal;
    private String ipExternal;
    private List<PortInfo> ports;

    private Long cpuMillicores;
    private Long memoryBytes;
    private Double diskPercent;
    private String cpuFormatted;
    private String memoryFormatted;
    private String diskFormatted;

    private Instant createdAt;
    private Instant observedAt;
    private Long ageDays;
    private Boolean isNew;
    private Boolean imageUpdatedRecently;
}
