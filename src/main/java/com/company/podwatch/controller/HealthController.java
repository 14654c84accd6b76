package com.company.podwatch.controller;

import com.company.podwatch.cache.SnapshotStore;
import com.company.podwatch.scheduled.CycleResult;
import com.company.podwatch.scheduled.MonitoringCycle;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final MonitoringCycle monitoringCycle;
    private final SnapshotStore snapshotStore;

    @GetMapping
    @Operation(summary = "Health check with poll loop status")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now());
        response.put("service", "podwatch-service");
        response.put("version", "1.0.0");
        response.put("cycleState", monitoringCycle.getState());
        response.put("baselineInitialized", snapshotStore.isInitialized());
        response.put("trackedResources", snapshotStore.size());

        CycleResult last = monitoringCycle.getLastResult();
        if (last != null) {
            response.put("lastCycleSuccess", last.isSuccess());
            response.put("lastCycleAt", last.getFinishedAt());
        }

        return ResponseEntity.ok(response);
    }
}
