package com.company.podwatch.controller;

import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.MetricSample;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.enums.ChangeType;
import com.company.podwatch.domain.enums.ResourceKind;
import com.company.podwatch.dto.response.NodeStatsResponse;
import com.company.podwatch.dto.response.ResourceStatusResponse;
import com.company.podwatch.service.MonitoringQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/monitoring")
@Tag(name = "Monitoring", description = "Current cluster state and change history")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class MonitoringQueryController {

    private final MonitoringQueryService queryService;
    private final MeterRegistry meterRegistry;

    @GetMapping("/resources")
    @Operation(
            summary = "Current state of all observed pods and nodes",
            description = "Served from the last successful poll; includes age and recent image updates"
    )
    @PreAuthorize("hasAnyRole('PODWATCH_VIEWER', 'PODWATCH_ADMIN')")
    public ResponseEntity<List<ResourceStatusResponse>> getResources(
            @Parameter(description = "Restrict to one namespace; nodes are listed only without a filter")
            @RequestParam(required = false) String namespace) {

        meterRegistry.counter("api.monitoring.requests", "endpoint", "resources").increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(15, TimeUnit.SECONDS).cachePrivate())
                .body(queryService.getCurrentSnapshots(namespace));
    }

    @GetMapping("/nodes")
    @Operation(summary = "Node readiness, capacity and pod counts")
    @PreAuthorize("hasAnyRole('PODWATCH_VIEWER', 'PODWATCH_ADMIN')")
    public ResponseEntity<List<NodeStatsResponse>> getNodes() {
        meterRegistry.counter("api.monitoring.requests", "endpoint", "nodes").increment();

        return ResponseEntity.ok(queryService.getNodes());
    }

    @GetMapping("/changes")
    @Operation(summary = "Status, image, new and removed events, newest first")
    @PreAuthorize("hasAnyRole('PODWATCH_VIEWER', 'PODWATCH_ADMIN')")
    public ResponseEntity<List<ChangeEvent>> getChanges(
            @RequestParam(defaultValue = "7") @Min(1) @Max(365) int days,
            @RequestParam(required = false) String namespace,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) ChangeType changeType,
            @RequestParam(required = false) @Min(1) @Max(1000) Integer limit) {

        meterRegistry.counter("api.monitoring.requests", "endpoint", "changes").increment();

        return ResponseEntity.ok(queryService.getRecentChanges(days, namespace, name, changeType, limit));
    }

    @GetMapping("/metrics/{kind}/{namespace}/{name}")
    @Operation(
            summary = "Usage samples of one resource, oldest first",
            description = "For nodes the namespace segment is ignored; use '-'"
    )
    @PreAuthorize("hasAnyRole('PODWATCH_VIEWER', 'PODWATCH_ADMIN')")
    public ResponseEntity<List<MetricSample>> getMetrics(
            @PathVariable String kind,
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours) {

        ResourceKey key = new ResourceKey(ResourceKind.fromString(kind), namespace, name);
        meterRegistry.counter("api.monitoring.requests", "endpoint", "metrics").increment();

        return ResponseEntity.ok(queryService.getMetrics(key, hours));
    }

    @GetMapping("/alerts")
    @Operation(summary = "Alert records with their delivery outcomes, newest first")
    @PreAuthorize("hasAnyRole('PODWATCH_VIEWER', 'PODWATCH_ADMIN')")
    public ResponseEntity<List<AlertRecord>> getAlerts(
            @RequestParam(defaultValue = "7") @Min(1) @Max(365) int days) {

        meterRegistry.counter("api.monitoring.requests", "endpoint", "alerts").increment();

        return ResponseEntity.ok(queryService.getRecentAlerts(days));
    }
}
