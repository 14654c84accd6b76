package com.company.podwatch.controller;

import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.dto.request.CleanupRequest;
import com.company.podwatch.dto.request.RestartResourceRequest;
import com.company.podwatch.dto.request.UpdateConfigRequest;
import com.company.podwatch.dto.response.CleanupResponse;
import com.company.podwatch.dto.response.CycleRunResponse;
import com.company.podwatch.dto.response.StorageInfoResponse;
import com.company.podwatch.service.AdminService;
import com.company.podwatch.settings.PodWatchSettings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Administration", description = "Settings, restarts, cleanup and diagnostics")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
@PreAuthorize("hasRole('PODWATCH_ADMIN')")
public class AdminController {

    static final String CREDENTIAL_HEADER = "X-Admin-Credential";

    private final AdminService adminService;

    @GetMapping("/config")
    @Operation(summary = "Current settings with secrets masked")
    public ResponseEntity<PodWatchSettings> getConfig() {
        return ResponseEntity.ok(adminService.getConfig());
    }

    @PutMapping("/config")
    @Operation(
            summary = "Replace settings",
            description = "Masked or omitted secrets keep their current value; missing fields take defaults"
    )
    public ResponseEntity<PodWatchSettings> updateConfig(
            @Parameter(description = "Admin password") @RequestHeader(CREDENTIAL_HEADER) String credential,
            @Valid @RequestBody UpdateConfigRequest request) {

        return ResponseEntity.ok(
                adminService.updateConfig(request.getSettings(), request.getNewAdminPassword(), credential));
    }

    @PostMapping("/resources/restart")
    @Operation(summary = "Delete a pod so its controller recreates it")
    public ResponseEntity<Map<String, Object>> restartResource(
            @RequestHeader(CREDENTIAL_HEADER) String credential,
            @Valid @RequestBody RestartResourceRequest request) {

        ResourceKey key = ResourceKey.pod(request.getNamespace(), request.getName());
        adminService.triggerManualRestart(key, credential);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "restarting");
        response.put("namespace", key.getNamespace());
        response.put("name", key.getName());
        response.put("timestamp", Instant.now());
        return ResponseEntity.accepted().body(response);
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Delete history older than the retention period")
    public ResponseEntity<CleanupResponse> cleanup(
            @RequestHeader(CREDENTIAL_HEADER) String credential,
            @Valid @RequestBody(required = false) CleanupRequest request) {

        Integer days = request != null ? request.getRetentionDays() : null;
        return ResponseEntity.ok(adminService.runCleanup(days, credential));
    }

    @PostMapping("/check-now")
    @Operation(summary = "Run a poll cycle immediately")
    public ResponseEntity<CycleRunResponse> checkNow(@RequestHeader(CREDENTIAL_HEADER) String credential) {
        return ResponseEntity.ok(adminService.triggerCycle(credential));
    }

    @PostMapping("/destinations/{destinationId}/test")
    @Operation(summary = "Send a test notification to one destination")
    public ResponseEntity<AlertRecord> testDestination(
            @RequestHeader(CREDENTIAL_HEADER) String credential,
            @PathVariable String destinationId) {

        return ResponseEntity.ok(adminService.sendTestNotification(destinationId, credential));
    }

    @GetMapping("/storage")
    @Operation(summary = "Row counts per history table")
    public ResponseEntity<StorageInfoResponse> storage() {
        return ResponseEntity.ok(adminService.storageInfo());
    }
}
